package com.medusa.network.protocol;

/**
 * Exception thrown when a request line cannot be parsed.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
