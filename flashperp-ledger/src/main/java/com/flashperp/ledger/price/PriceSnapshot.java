package com.flashperp.ledger.price;

import java.time.Duration;
import java.time.Instant;

/**
 * A price read pinned for check-then-act use, so a liquidation check and the liquidation
 * itself see the same price.
 */
public record PriceSnapshot(
    String instrument,
    long price,
    Instant observedAt
) {
    public boolean isOlderThan(Duration maxAge, Instant now) {
        return observedAt.plus(maxAge).isBefore(now);
    }
}
