package com.flashperp.core.model;

/**
 * Outcome of a close or decrease.
 * {@code payout - shortfall == collateralReturned + realizedPnl} always holds.
 */
public record CloseResult(
    long positionId,
    long sizeClosed,
    long exitPrice,
    long realizedPnl,
    long collateralReturned,
    long payout,
    long shortfall,
    FundingSettlement funding,
    boolean fullyClosed
) {
    public boolean hasShortfall() {
        return shortfall > 0;
    }
}
