package com.fintech.timeseries.service;

import com.fintech.timeseries.ingestion.CollectionStatus;

import java.time.Instant;

/**
 * Health of one configured source as returned by GetStatus.
 */
public record SourceStatus(
    String sourceId,
    String dataset,
    String resolution,
    Long watermark,
    Instant lastAttempt,
    Instant lastSuccess,
    CollectionStatus lastOutcome,
    String lastMessage,
    long errorCount,
    int consecutiveFailures,
    long totalAppended
) {
}
