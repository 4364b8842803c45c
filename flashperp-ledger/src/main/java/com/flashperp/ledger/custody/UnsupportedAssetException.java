package com.flashperp.ledger.custody;

public class UnsupportedAssetException extends CustodyException {

    private final String asset;

    public UnsupportedAssetException(String asset) {
        super("Unsupported asset: " + asset);
        this.asset = asset;
    }

    public String getAsset() {
        return asset;
    }
}
