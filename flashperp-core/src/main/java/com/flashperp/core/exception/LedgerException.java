package com.flashperp.core.exception;

/**
 * Base type for rejected ledger operations. A rejected operation leaves no state change behind.
 */
public class LedgerException extends Exception {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
