package com.fintech.timeseries.ingestion;

import java.time.Instant;

/**
 * Health snapshot of one source across cycles.
 */
public record CollectorStatus(
    String sourceId,
    Instant lastAttempt,
    Instant lastSuccess,
    CollectionStatus lastOutcome,
    String lastMessage,
    long errorCount,
    int consecutiveFailures,
    long totalAppended,
    Long watermark
) {

    static CollectorStatus initial(String sourceId) {
        return new CollectorStatus(sourceId, null, null, null, null, 0, 0, 0, null);
    }

    CollectorStatus after(CollectionResult result, Instant at) {
        boolean failed = result.isFailure();
        return new CollectorStatus(
            sourceId,
            at,
            failed ? lastSuccess : at,
            result.status(),
            result.message(),
            failed ? errorCount + 1 : errorCount,
            failed ? consecutiveFailures + 1 : 0,
            totalAppended + result.appended(),
            result.watermark() != null ? result.watermark() : watermark);
    }
}
