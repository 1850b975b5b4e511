package com.fintech.timeseries.ingestion;

/**
 * Outcome of one collector run.
 */
public enum CollectionStatus {

    /** New rows were merged. */
    SUCCESS(false),
    /** Upstream offered nothing newer than the watermark. */
    NO_NEW_DATA(false),
    /** The batch was unusable and was not merged. */
    REJECTED(true),
    /** Fetch or store failure after retries. */
    FAILED(true),
    /** Exceeded its per-task deadline and was cancelled. */
    TIMED_OUT(true),
    /** The previous run of the same source was still in flight. */
    SKIPPED(true);

    private final boolean failure;

    CollectionStatus(boolean failure) {
        this.failure = failure;
    }

    public boolean isFailure() {
        return failure;
    }
}
