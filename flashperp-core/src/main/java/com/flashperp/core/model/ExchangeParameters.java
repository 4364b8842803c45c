package com.flashperp.core.model;

import java.time.Duration;

/**
 * Process-wide trading parameters. Immutable: administrators replace the whole snapshot and each
 * ledger operation reads one snapshot when it starts.
 */
public record ExchangeParameters(
    Duration fundingInterval,
    long fundingRateFactor,
    long maintenanceMarginBps,
    long liquidationFeeBps,
    long takerFeeBps,
    long makerFeeBps,
    int maxLeverage,
    boolean onePositionPerInstrument,
    FundingSettlementPolicy fundingSettlementPolicy,
    Duration maxPriceAge
) {
    public ExchangeParameters {
        if (fundingInterval == null || fundingInterval.isZero() || fundingInterval.isNegative()) {
            throw new IllegalArgumentException("fundingInterval must be positive");
        }
        if (fundingRateFactor < 0) {
            throw new IllegalArgumentException("fundingRateFactor must not be negative");
        }
        if (maintenanceMarginBps <= 0 || maintenanceMarginBps >= 10_000) {
            throw new IllegalArgumentException("maintenanceMarginBps must be in (0, 10000)");
        }
        if (liquidationFeeBps < 0 || takerFeeBps < 0 || makerFeeBps < 0) {
            throw new IllegalArgumentException("fee rates must not be negative");
        }
        if (maxLeverage < 1) {
            throw new IllegalArgumentException("maxLeverage must be at least 1");
        }
        if (fundingSettlementPolicy == null) {
            throw new IllegalArgumentException("fundingSettlementPolicy is required");
        }
        if (maxPriceAge == null || maxPriceAge.isNegative()) {
            throw new IllegalArgumentException("maxPriceAge must not be negative");
        }
    }

    public static ExchangeParameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .fundingInterval(fundingInterval)
                .fundingRateFactor(fundingRateFactor)
                .maintenanceMarginBps(maintenanceMarginBps)
                .liquidationFeeBps(liquidationFeeBps)
                .takerFeeBps(takerFeeBps)
                .makerFeeBps(makerFeeBps)
                .maxLeverage(maxLeverage)
                .onePositionPerInstrument(onePositionPerInstrument)
                .fundingSettlementPolicy(fundingSettlementPolicy)
                .maxPriceAge(maxPriceAge);
    }

    public static class Builder {
        private Duration fundingInterval = Duration.ofHours(8);
        private long fundingRateFactor = 1000;
        private long maintenanceMarginBps = 200;
        private long liquidationFeeBps = 50;
        private long takerFeeBps = 5;
        private long makerFeeBps = 2;
        private int maxLeverage = 50;
        private boolean onePositionPerInstrument;
        private FundingSettlementPolicy fundingSettlementPolicy = FundingSettlementPolicy.CLAMP_AT_ZERO;
        private Duration maxPriceAge = Duration.ofMinutes(5);

        public Builder fundingInterval(Duration v) { this.fundingInterval = v; return this; }
        public Builder fundingRateFactor(long v) { this.fundingRateFactor = v; return this; }
        public Builder maintenanceMarginBps(long v) { this.maintenanceMarginBps = v; return this; }
        public Builder liquidationFeeBps(long v) { this.liquidationFeeBps = v; return this; }
        public Builder takerFeeBps(long v) { this.takerFeeBps = v; return this; }
        public Builder makerFeeBps(long v) { this.makerFeeBps = v; return this; }
        public Builder maxLeverage(int v) { this.maxLeverage = v; return this; }
        public Builder onePositionPerInstrument(boolean v) { this.onePositionPerInstrument = v; return this; }
        public Builder fundingSettlementPolicy(FundingSettlementPolicy v) { this.fundingSettlementPolicy = v; return this; }
        public Builder maxPriceAge(Duration v) { this.maxPriceAge = v; return this; }

        public ExchangeParameters build() {
            return new ExchangeParameters(fundingInterval, fundingRateFactor, maintenanceMarginBps,
                    liquidationFeeBps, takerFeeBps, makerFeeBps, maxLeverage, onePositionPerInstrument,
                    fundingSettlementPolicy, maxPriceAge);
        }
    }
}
