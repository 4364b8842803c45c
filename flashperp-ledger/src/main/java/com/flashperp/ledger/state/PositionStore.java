package com.flashperp.ledger.state;

import com.flashperp.core.model.Position;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Open positions keyed by id. Ids start at 1 and are never reused.
 */
public class PositionStore {

    private final Map<Long, PositionSlot> slots = new ConcurrentHashMap<>();
    private record PairKey(String owner, String instrument) {}

    private final Map<PairKey, Integer> openPairs = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong(1);

    public long nextId() {
        return idSequence.getAndIncrement();
    }

    /**
     * Count a new position on the (owner, instrument) pair.
     *
     * @param exclusive refuse the claim if the pair already has an open position
     * @return false if the claim was refused
     */
    public boolean claimPair(String owner, String instrument, boolean exclusive) {
        boolean[] claimed = {false};
        openPairs.compute(pairKey(owner, instrument), (key, count) -> {
            int current = count == null ? 0 : count;
            if (exclusive && current > 0) {
                return count;
            }
            claimed[0] = true;
            return current + 1;
        });
        return claimed[0];
    }

    public void releasePair(String owner, String instrument) {
        openPairs.computeIfPresent(pairKey(owner, instrument), (key, count) -> count <= 1 ? null : count - 1);
    }

    public int openCount(String owner, String instrument) {
        return openPairs.getOrDefault(pairKey(owner, instrument), 0);
    }

    /**
     * Publish a freshly opened position.
     */
    public PositionSlot insert(Position position) {
        PositionSlot slot = new PositionSlot(position.copy());
        if (slots.putIfAbsent(position.getId(), slot) != null) {
            throw new IllegalStateException("position id already in use: " + position.getId());
        }
        return slot;
    }

    public Optional<PositionSlot> slot(long positionId) {
        return Optional.ofNullable(slots.get(positionId));
    }

    /**
     * Replace the committed state of a position. Caller holds the slot lock.
     */
    public void update(PositionSlot slot, Position updated) {
        slot.commit(updated);
    }

    /**
     * Remove a position for good. Caller holds the slot lock.
     */
    public void remove(PositionSlot slot, Position last) {
        slot.clear();
        slots.remove(slot.getId(), slot);
        releasePair(last.getOwner(), last.getInstrument());
    }

    public Optional<Position> find(long positionId) {
        PositionSlot slot = slots.get(positionId);
        return slot == null ? Optional.empty() : slot.current();
    }

    public List<Position> all() {
        return slots.values().stream()
                .map(PositionSlot::current)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparingLong(Position::getId))
                .toList();
    }

    public List<Position> byInstrument(String instrument) {
        return all().stream()
                .filter(p -> instrument.equals(p.getInstrument()))
                .toList();
    }

    public List<Position> byOwner(String owner) {
        return all().stream()
                .filter(p -> Objects.equals(owner, p.getOwner()))
                .toList();
    }

    public int size() {
        return slots.size();
    }

    private static PairKey pairKey(String owner, String instrument) {
        return new PairKey(owner, instrument);
    }
}
