package com.flashperp.core.exception;

/**
 * Custody refused to debit the owner. The operation was rolled back.
 */
public class InsufficientFundsException extends LedgerException {

    private final String owner;
    private final long requested;

    public InsufficientFundsException(String owner, long requested, String message, Throwable cause) {
        super(message, cause);
        this.owner = owner;
        this.requested = requested;
    }

    public String getOwner() {
        return owner;
    }

    public long getRequested() {
        return requested;
    }
}
