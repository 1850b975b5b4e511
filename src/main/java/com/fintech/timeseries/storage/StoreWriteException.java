package com.fintech.timeseries.storage;

/**
 * A segment or watermark could not be made durable. Nothing was published.
 */
public class StoreWriteException extends RuntimeException {

    public StoreWriteException(String message) {
        super(message);
    }

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
