package com.flashperp.ledger.price;

public class PriceUnavailableException extends Exception {

    public enum Reason {
        NOT_SUPPORTED,
        STALE
    }

    private final String instrument;
    private final Reason reason;

    public PriceUnavailableException(String instrument, Reason reason, String message) {
        super(message);
        this.instrument = instrument;
        this.reason = reason;
    }

    public String getInstrument() {
        return instrument;
    }

    public Reason getReason() {
        return reason;
    }
}
