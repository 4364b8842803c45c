package com.flashperp.core.model;

import java.time.Instant;

/**
 * Open leveraged position held by one owner on one instrument.
 * Amounts are fixed-point longs (8 decimals).
 */
public class Position {

    private final long id;
    private final String owner;
    private final String instrument;
    private final Side side;
    private final int leverage;
    private long collateral;
    private long size;
    private long entryPrice;
    private Instant lastFundingTime;
    private long accumulatedFunding;
    private final Instant openedAt;
    private Instant updatedAt;

    public Position(long id, String owner, String instrument, Side side, long collateral,
                    long size, long entryPrice, int leverage, Instant openedAt) {
        this.id = id;
        this.owner = owner;
        this.instrument = instrument;
        this.side = side;
        this.collateral = collateral;
        this.size = size;
        this.entryPrice = entryPrice;
        this.leverage = leverage;
        this.lastFundingTime = openedAt;
        this.accumulatedFunding = 0;
        this.openedAt = openedAt;
        this.updatedAt = openedAt;
    }

    private Position(Position other) {
        this.id = other.id;
        this.owner = other.owner;
        this.instrument = other.instrument;
        this.side = other.side;
        this.leverage = other.leverage;
        this.collateral = other.collateral;
        this.size = other.size;
        this.entryPrice = other.entryPrice;
        this.lastFundingTime = other.lastFundingTime;
        this.accumulatedFunding = other.accumulatedFunding;
        this.openedAt = other.openedAt;
        this.updatedAt = other.updatedAt;
    }

    /**
     * Detached copy. Ledger operations mutate a copy and publish it only on commit.
     */
    public Position copy() {
        return new Position(this);
    }

    /**
     * Apply a funding settlement.
     *
     * @param collateralDelta amount removed from collateral (negative adds)
     * @param settledAt       new last funding time
     */
    public void applyFunding(long collateralDelta, Instant settledAt) {
        collateral = Math.subtractExact(collateral, collateralDelta);
        accumulatedFunding = Math.addExact(accumulatedFunding, collateralDelta);
        lastFundingTime = settledAt;
        updatedAt = settledAt;
    }

    /**
     * Add size and collateral at a new volume-weighted entry price.
     */
    public void increase(long addedCollateral, long addedSize, long newEntryPrice, Instant at) {
        collateral = Math.addExact(collateral, addedCollateral);
        size = Math.addExact(size, addedSize);
        entryPrice = newEntryPrice;
        updatedAt = at;
    }

    /**
     * Remove size and release the matching collateral. Entry price is unchanged.
     */
    public void reduce(long removedSize, long releasedCollateral, Instant at) {
        if (removedSize > size) {
            throw new IllegalArgumentException("cannot remove " + removedSize + " from size " + size);
        }
        size -= removedSize;
        collateral = Math.subtractExact(collateral, releasedCollateral);
        updatedAt = at;
    }

    public boolean isOpen() {
        return size > 0;
    }

    public boolean isOwnedBy(String trader) {
        return owner.equals(trader);
    }

    // Getters
    public long getId() { return id; }
    public String getOwner() { return owner; }
    public String getInstrument() { return instrument; }
    public Side getSide() { return side; }
    public long getCollateral() { return collateral; }
    public long getSize() { return size; }
    public long getEntryPrice() { return entryPrice; }
    public Instant getLastFundingTime() { return lastFundingTime; }
    public long getAccumulatedFunding() { return accumulatedFunding; }
    public int getLeverage() { return leverage; }
    public Instant getOpenedAt() { return openedAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return "Position{id=" + id + ", owner=" + owner + ", instrument=" + instrument + ", side=" + side
                + ", collateral=" + collateral + ", size=" + size + ", entryPrice=" + entryPrice
                + ", leverage=" + leverage + ", lastFundingTime=" + lastFundingTime + "}";
    }
}
