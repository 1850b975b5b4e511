package com.fintech.timeseries.ingestion;

/**
 * Non-recoverable fetch failure (missing resource, rejected request).
 * Not retried within the cycle.
 */
public class SourceFetchException extends IngestionException {

    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
