package com.flashperp.ledger.state;

import com.flashperp.core.model.Position;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holder for one position id. All mutations of the position happen under {@link #lock()}.
 * The published position is never mutated; commits replace it with a new copy.
 */
public final class PositionSlot {

    private final long id;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Position position;

    PositionSlot(Position position) {
        this.id = position.getId();
        this.position = position;
    }

    public long getId() {
        return id;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    /**
     * Current committed state, empty once closed or liquidated.
     */
    public Optional<Position> current() {
        Position p = position;
        return p == null ? Optional.empty() : Optional.of(p.copy());
    }

    void commit(Position updated) {
        requireLocked();
        this.position = updated.copy();
    }

    void clear() {
        requireLocked();
        this.position = null;
    }

    private void requireLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("position " + id + " modified without holding its lock");
        }
    }
}
