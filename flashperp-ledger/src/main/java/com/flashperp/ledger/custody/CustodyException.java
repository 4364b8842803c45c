package com.flashperp.ledger.custody;

public class CustodyException extends Exception {

    public CustodyException(String message) {
        super(message);
    }
}
