package com.flashperp.ledger.price;

import java.time.Instant;

/**
 * Mark (traded) and index (reference) price of an instrument, 8-decimal fixed point.
 */
public record MarkIndexPrices(
    String instrument,
    long markPrice,
    long indexPrice,
    Instant updatedAt
) {
    /**
     * Premium of mark over index, signed.
     */
    public long premium() {
        return Math.subtractExact(markPrice, indexPrice);
    }
}
