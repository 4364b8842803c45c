package com.flashperp.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Funding state of one instrument. The rate is signed basis points per funding interval.
 */
public record InstrumentFundingState(
    String instrument,
    long globalFundingRate,
    Instant lastFundingUpdateTime
) {
    public static InstrumentFundingState initial(String instrument, Instant onboardedAt) {
        return new InstrumentFundingState(instrument, 0, onboardedAt);
    }

    public InstrumentFundingState withRate(long rate, Instant updatedAt) {
        return new InstrumentFundingState(instrument, rate, updatedAt);
    }

    /**
     * Whether a new rate is due at {@code now} for the given interval.
     */
    public boolean isDue(Instant now, Duration fundingInterval) {
        return !now.isBefore(lastFundingUpdateTime.plus(fundingInterval));
    }
}
