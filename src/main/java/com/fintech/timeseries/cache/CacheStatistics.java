package com.fintech.timeseries.cache;

/**
 * Point-in-time counters of the result cache.
 */
public record CacheStatistics(
    long size,
    long hits,
    long misses,
    long evictions,
    long ttlSeconds
) {

    public double hitRate() {
        long requests = hits + misses;
        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}
