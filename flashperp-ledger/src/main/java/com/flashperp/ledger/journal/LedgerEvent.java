package com.flashperp.ledger.journal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Base event type for ledger journal entries.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PositionEvent.class, name = "position"),
    @JsonSubTypes.Type(value = FundingEvent.class, name = "funding"),
    @JsonSubTypes.Type(value = ShortfallEvent.class, name = "shortfall")
})
public abstract class LedgerEvent {
    private Instant timestamp;

    protected LedgerEvent() {
    }

    protected LedgerEvent(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public abstract String getEventType();

    @JsonIgnore
    public abstract String getSummary();

    /**
     * True if the event belongs to the history of position {@code positionId}.
     */
    public abstract boolean concerns(long positionId);
}
