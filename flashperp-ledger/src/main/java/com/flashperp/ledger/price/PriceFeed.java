package com.flashperp.ledger.price;

/**
 * Read access to instrument prices.
 */
public interface PriceFeed {

    /**
     * Current mark price.
     */
    long price(String instrument) throws PriceUnavailableException;

    /**
     * Current mark and index prices.
     */
    MarkIndexPrices prices(String instrument) throws PriceUnavailableException;
}
