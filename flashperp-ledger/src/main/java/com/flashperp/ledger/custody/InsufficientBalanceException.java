package com.flashperp.ledger.custody;

public class InsufficientBalanceException extends CustodyException {

    private final long available;
    private final long requested;

    public InsufficientBalanceException(String message, long available, long requested) {
        super(message);
        this.available = available;
        this.requested = requested;
    }

    public long getAvailable() {
        return available;
    }

    public long getRequested() {
        return requested;
    }
}
