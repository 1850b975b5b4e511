package com.fintech.timeseries.cache;

import com.fintech.timeseries.query.AggregateTable;

import java.time.Duration;

/**
 * A computed result with its insertion time on the cache ticker.
 */
record CacheEntry(AggregateTable result, long computedAtNanos, Duration ttl) {

    boolean isExpired(long nowNanos) {
        return nowNanos - computedAtNanos > ttl.toNanos();
    }
}
