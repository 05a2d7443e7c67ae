package com.medusa.core;

/**
 * Exception thrown when a store operation cannot complete.
 * The store remains usable after one of these.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
