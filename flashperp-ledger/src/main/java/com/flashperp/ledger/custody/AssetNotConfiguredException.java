package com.flashperp.ledger.custody;

public class AssetNotConfiguredException extends CustodyException {

    public AssetNotConfiguredException(String instrument) {
        super("No collateral asset configured for " + instrument);
    }
}
