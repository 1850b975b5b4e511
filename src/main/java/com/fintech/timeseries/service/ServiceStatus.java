package com.fintech.timeseries.service;

import com.fintech.timeseries.cache.CacheStatistics;

import java.util.List;

/**
 * Result of GetStatus: per-source ingestion health plus store and cache state.
 */
public record ServiceStatus(
    boolean storeHealthy,
    String circuitBreakerState,
    List<SourceStatus> sources,
    CacheStatistics cache
) {
}
