package com.fintech.timeseries.ingestion;

/**
 * A single row could not be parsed. Skipped and counted by the parser;
 * never fatal to the batch.
 */
public class RowParseException extends IngestionException {

    public RowParseException(String message) {
        super(message);
    }

    public RowParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
