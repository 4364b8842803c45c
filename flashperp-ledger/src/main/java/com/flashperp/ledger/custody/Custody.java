package com.flashperp.ledger.custody;

/**
 * Transfer primitives between traders and the exchange pool.
 * An instance is a capability: whoever holds it may move collateral.
 */
public interface Custody {

    /**
     * Move {@code amount} of {@code asset} from {@code owner} into the exchange pool.
     */
    void debit(String owner, String asset, long amount) throws InsufficientBalanceException, UnsupportedAssetException;

    /**
     * Move {@code amount} of {@code asset} from the exchange pool to {@code owner}.
     */
    void credit(String owner, String asset, long amount) throws UnsupportedAssetException;

    /**
     * Collateral asset positions on {@code instrument} are margined in.
     */
    String collateralAssetFor(String instrument) throws AssetNotConfiguredException;
}
