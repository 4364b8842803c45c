package com.flashperp.core.model;

/**
 * Parameters of a position open. {@code referencePrice} is the execution price the caller assumed;
 * the fetched price must lie within {@code slippageToleranceBps} of it.
 */
public record OpenPositionRequest(
    String owner,
    String instrument,
    Side side,
    long collateral,
    long size,
    int leverage,
    long maxFundingRateBps,
    long referencePrice,
    long slippageToleranceBps
) {
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String owner;
        private String instrument;
        private Side side;
        private long collateral;
        private long size;
        private int leverage = 1;
        private long maxFundingRateBps = Long.MAX_VALUE;
        private long referencePrice;
        private long slippageToleranceBps;

        public Builder owner(String owner) { this.owner = owner; return this; }
        public Builder instrument(String instrument) { this.instrument = instrument; return this; }
        public Builder side(Side side) { this.side = side; return this; }
        public Builder collateral(long collateral) { this.collateral = collateral; return this; }
        public Builder size(long size) { this.size = size; return this; }
        public Builder leverage(int leverage) { this.leverage = leverage; return this; }
        public Builder maxFundingRateBps(long maxFundingRateBps) { this.maxFundingRateBps = maxFundingRateBps; return this; }
        public Builder referencePrice(long referencePrice) { this.referencePrice = referencePrice; return this; }
        public Builder slippageToleranceBps(long slippageToleranceBps) { this.slippageToleranceBps = slippageToleranceBps; return this; }

        public OpenPositionRequest build() {
            if (instrument == null) throw new IllegalArgumentException("instrument is required");
            if (side == null) throw new IllegalArgumentException("side is required");
            return new OpenPositionRequest(owner, instrument, side, collateral, size, leverage,
                    maxFundingRateBps, referencePrice, slippageToleranceBps);
        }
    }
}
