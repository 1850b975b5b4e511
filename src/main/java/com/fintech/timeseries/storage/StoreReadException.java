package com.fintech.timeseries.storage;

/**
 * A published segment could not be read back.
 */
public class StoreReadException extends RuntimeException {

    public StoreReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
