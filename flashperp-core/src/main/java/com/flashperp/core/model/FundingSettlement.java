package com.flashperp.core.model;

import java.time.Instant;

/**
 * Outcome of settling funding on one position.
 *
 * @param rateBps   rate charged over all elapsed intervals
 * @param payment   signed amount owed for the elapsed intervals (positive = position paid)
 * @param applied   signed amount actually moved out of collateral
 * @param unpaid    part of a payment that could not be taken because collateral ran out
 */
public record FundingSettlement(
    long positionId,
    long intervals,
    long rateBps,
    long payment,
    long applied,
    long unpaid,
    Instant settledAt
) {
    public static FundingSettlement none(long positionId, Instant at) {
        return new FundingSettlement(positionId, 0, 0, 0, 0, 0, at);
    }

    public boolean isApplied() {
        return intervals > 0;
    }
}
