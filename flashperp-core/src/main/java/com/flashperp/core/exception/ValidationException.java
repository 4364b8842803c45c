package com.flashperp.core.exception;

/**
 * Bad input detected before any state was read or changed.
 */
public class ValidationException extends LedgerException {

    public enum Reason {
        ZERO_AMOUNT,
        LEVERAGE_OUT_OF_RANGE,
        SIZE_EXCEEDS_POSITION,
        INSUFFICIENT_MARGIN,
        INVALID_ACCOUNT,
        MISSING_FIELD
    }

    private final Reason reason;

    public ValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
