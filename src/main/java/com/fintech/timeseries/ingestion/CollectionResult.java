package com.fintech.timeseries.ingestion;

/**
 * Result of one collector run, as reported in the cycle summary.
 *
 * @param sourceId The source that ran
 * @param status Outcome of the run
 * @param appended Rows appended to the store
 * @param parseFailures Rows skipped as unparseable
 * @param watermark Watermark after the run, null if the source never merged
 * @param message Error detail for failed runs, null otherwise
 */
public record CollectionResult(
    String sourceId,
    CollectionStatus status,
    int appended,
    int parseFailures,
    Long watermark,
    String message
) {

    public static CollectionResult success(String sourceId, int appended, int parseFailures, long watermark) {
        return new CollectionResult(sourceId, CollectionStatus.SUCCESS, appended, parseFailures, watermark, null);
    }

    public static CollectionResult noNewData(String sourceId, int parseFailures, Long watermark) {
        return new CollectionResult(sourceId, CollectionStatus.NO_NEW_DATA, 0, parseFailures, watermark, null);
    }

    public static CollectionResult failure(String sourceId, CollectionStatus status, String message) {
        return new CollectionResult(sourceId, status, 0, 0, null, message);
    }

    public boolean isFailure() {
        return status.isFailure();
    }
}
