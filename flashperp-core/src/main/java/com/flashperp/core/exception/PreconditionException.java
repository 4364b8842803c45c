package com.flashperp.core.exception;

/**
 * Operation not allowed in the current ledger state.
 */
public class PreconditionException extends LedgerException {

    public enum Reason {
        PAUSED,
        UNSUPPORTED_INSTRUMENT,
        POSITION_NOT_FOUND,
        UNAUTHORIZED,
        FUNDING_RATE_EXCEEDED,
        SLIPPAGE_EXCEEDED,
        NOT_LIQUIDATABLE,
        POSITION_ALREADY_OPEN,
        PRICE_UNAVAILABLE,
        UNSUPPORTED_ASSET,
        STALE_SNAPSHOT
    }

    private final Reason reason;

    public PreconditionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public PreconditionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
