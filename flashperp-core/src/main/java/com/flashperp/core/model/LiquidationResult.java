package com.flashperp.core.model;

/**
 * Outcome of a liquidation. The liquidator receives {@code fee}, the owner {@code ownerPayout}.
 */
public record LiquidationResult(
    long positionId,
    String liquidator,
    long price,
    long pnl,
    long remainingCollateral,
    long fee,
    long ownerPayout,
    long shortfall,
    FundingSettlement funding
) {
    public boolean hasShortfall() {
        return shortfall > 0;
    }
}
