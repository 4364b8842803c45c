package com.flashperp.core.model;

/**
 * What funding settlement does when a payment exceeds the position's collateral.
 */
public enum FundingSettlementPolicy {
    /** Collateral stops at zero; the unpaid remainder is reported as a shortfall. */
    CLAMP_AT_ZERO,
    /** Collateral may go negative until liquidation closes the position. */
    ALLOW_NEGATIVE
}
