package com.fintech.timeseries.ingestion;

/**
 * Network timeout, rate limiting or a temporarily unavailable upstream.
 * Retried with backoff by {@link RetryPolicy}.
 */
public class TransientFetchException extends IngestionException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
