package com.streamfirst.ddns.ports;

/**
 * Raised when a stored document cannot be read as a record set.
 */
public class RecordSetFormatException extends RuntimeException {

    public RecordSetFormatException(String message) {
        super(message);
    }

    public RecordSetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
