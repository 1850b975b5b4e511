package com.fintech.timeseries.ingestion;

/**
 * Base class of collector-level failures. Caught by the collector and
 * reported in the cycle summary; never propagated to the scheduler.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
