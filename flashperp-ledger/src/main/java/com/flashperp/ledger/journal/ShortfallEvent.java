package com.flashperp.ledger.journal;

import java.time.Instant;

/**
 * A loss the ledger could not collect from the trader. Needs operator attention.
 */
public class ShortfallEvent extends LedgerEvent {

    public enum Source {
        CLOSE,
        DECREASE,
        LIQUIDATION,
        FUNDING
    }

    private Source source;
    private long positionId;
    private String owner;
    private String instrument;
    private long amount;

    // For Jackson
    public ShortfallEvent() {}

    public ShortfallEvent(Source source, long positionId, String owner, String instrument,
                          long amount, Instant at) {
        super(at);
        this.source = source;
        this.positionId = positionId;
        this.owner = owner;
        this.instrument = instrument;
        this.amount = amount;
    }

    @Override
    public String getEventType() { return "shortfall"; }

    @Override
    public boolean concerns(long id) {
        return positionId == id;
    }

    @Override
    public String getSummary() {
        return String.format("[shortfall] %s #%d %s %s amount=%d", source, positionId, owner, instrument, amount);
    }

    // Getters for Jackson
    public Source getSource() { return source; }
    public long getPositionId() { return positionId; }
    public String getOwner() { return owner; }
    public String getInstrument() { return instrument; }
    public long getAmount() { return amount; }
}
