package com.flashperp.ledger.state;

import com.flashperp.core.model.InstrumentFundingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Supported instruments kept in a dense list, with an id to slot map for lookups.
 * Sweeps iterate the list; nothing scans an open keyspace.
 */
public class InstrumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstrumentRegistry.class);

    private final List<InstrumentSlot> slots = new CopyOnWriteArrayList<>();
    private final Map<String, InstrumentSlot> byInstrument = new ConcurrentHashMap<>();

    /**
     * Add an instrument with a zero funding rate. Returns false if it is already supported.
     */
    public synchronized boolean add(String instrument, Instant onboardedAt) {
        if (byInstrument.containsKey(instrument)) {
            return false;
        }
        InstrumentSlot slot = new InstrumentSlot(instrument, slots.size(),
                InstrumentFundingState.initial(instrument, onboardedAt));
        slots.add(slot);
        byInstrument.put(instrument, slot);
        log.info("Instrument added: {} (slot {})", instrument, slot.getIndex());
        return true;
    }

    public boolean isSupported(String instrument) {
        return instrument != null && byInstrument.containsKey(instrument);
    }

    public Optional<InstrumentSlot> find(String instrument) {
        return instrument == null ? Optional.empty() : Optional.ofNullable(byInstrument.get(instrument));
    }

    /**
     * Slots in onboarding order.
     */
    public List<InstrumentSlot> slots() {
        return List.copyOf(slots);
    }

    public List<String> instruments() {
        return slots.stream().map(InstrumentSlot::getInstrument).toList();
    }

    public int size() {
        return slots.size();
    }
}
