package com.flashperp.ledger.state;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Losses that could not be collected from traders, accumulated per instrument.
 */
public class ShortfallLedger {

    private final Map<String, Long> totals = new ConcurrentHashMap<>();

    public void record(String instrument, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("shortfall must not be negative: " + amount);
        }
        if (amount > 0) {
            totals.merge(instrument, amount, Math::addExact);
        }
    }

    public long total(String instrument) {
        return totals.getOrDefault(instrument, 0L);
    }

    public Map<String, Long> totals() {
        return Map.copyOf(totals);
    }
}
