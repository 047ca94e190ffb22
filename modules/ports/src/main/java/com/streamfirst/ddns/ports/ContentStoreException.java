package com.streamfirst.ddns.ports;

/**
 * Raised when the content store cannot be reached or returns an unexpected response.
 */
public class ContentStoreException extends RuntimeException {

    public ContentStoreException(String message) {
        super(message);
    }

    public ContentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
