package com.streamfirst.ddns.ports;

/**
 * Raised when a ledger call fails for infrastructure reasons (unreachable node, timeout,
 * rejected request). Callers treat it as transient.
 */
public class LedgerUnavailableException extends RuntimeException {

    public LedgerUnavailableException(String message) {
        super(message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
