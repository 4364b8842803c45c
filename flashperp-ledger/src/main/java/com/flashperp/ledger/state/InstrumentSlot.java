package com.flashperp.ledger.state;

import com.flashperp.core.model.InstrumentFundingState;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One supported instrument: its dense index, funding state and lock.
 * Position operations hold the read lock, funding-rate updates the write lock.
 */
public final class InstrumentSlot {

    private final String instrument;
    private final int index;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile InstrumentFundingState fundingState;

    InstrumentSlot(String instrument, int index, InstrumentFundingState fundingState) {
        this.instrument = instrument;
        this.index = index;
        this.fundingState = fundingState;
    }

    public String getInstrument() {
        return instrument;
    }

    public int getIndex() {
        return index;
    }

    public InstrumentFundingState getFundingState() {
        return fundingState;
    }

    /**
     * Replace the funding state. Caller must hold the write lock.
     */
    public void updateFundingState(InstrumentFundingState newState) {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("funding state of " + instrument + " updated without write lock");
        }
        this.fundingState = newState;
    }

    public ReentrantReadWriteLock.ReadLock readLock() {
        return lock.readLock();
    }

    public ReentrantReadWriteLock.WriteLock writeLock() {
        return lock.writeLock();
    }
}
