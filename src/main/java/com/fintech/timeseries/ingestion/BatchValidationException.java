package com.fintech.timeseries.ingestion;

/**
 * The batch as a whole is unusable (missing required column, corrupt
 * archive, no parseable rows). The batch is rejected without merging and
 * the watermark is left unchanged.
 */
public class BatchValidationException extends IngestionException {

    public BatchValidationException(String message) {
        super(message);
    }

    public BatchValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
