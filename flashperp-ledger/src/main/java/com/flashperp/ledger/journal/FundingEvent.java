package com.flashperp.ledger.journal;

import com.flashperp.core.model.FundingSettlement;
import com.flashperp.core.model.Position;

import java.time.Instant;

/**
 * Journal event for funding: a new instrument rate, or a settlement against one position.
 */
public class FundingEvent extends LedgerEvent {

    private String action; // rate_updated, settled
    private String instrument;
    private Long positionId;
    private long rateBps;
    private Long previousRateBps;
    private Long markPrice;
    private Long indexPrice;
    private Long intervals;
    private Long payment;
    private Long applied;

    // For Jackson
    public FundingEvent() {}

    private FundingEvent(String action, String instrument, long rateBps, Instant at) {
        super(at);
        this.action = action;
        this.instrument = instrument;
        this.rateBps = rateBps;
    }

    public static FundingEvent rateUpdated(String instrument, long previousRate, long newRate,
                                           long markPrice, long indexPrice, Instant at) {
        FundingEvent event = new FundingEvent("rate_updated", instrument, newRate, at);
        event.previousRateBps = previousRate;
        event.markPrice = markPrice;
        event.indexPrice = indexPrice;
        return event;
    }

    public static FundingEvent settled(Position position, FundingSettlement settlement) {
        FundingEvent event = new FundingEvent("settled", position.getInstrument(),
                settlement.rateBps(), settlement.settledAt());
        event.positionId = position.getId();
        event.intervals = settlement.intervals();
        event.payment = settlement.payment();
        event.applied = settlement.applied();
        return event;
    }

    @Override
    public String getEventType() { return "funding"; }

    @Override
    public boolean concerns(long id) {
        return positionId != null && positionId == id;
    }

    @Override
    public String getSummary() {
        if ("settled".equals(action)) {
            return String.format("[%s] #%d %s %d interval(s) at %dbps total, payment=%d",
                    action, positionId, instrument, intervals, rateBps, payment);
        }
        return String.format("[%s] %s %dbps -> %dbps (mark=%d index=%d)",
                action, instrument, previousRateBps, rateBps, markPrice, indexPrice);
    }

    // Getters for Jackson
    public String getAction() { return action; }
    public String getInstrument() { return instrument; }
    public Long getPositionId() { return positionId; }
    public long getRateBps() { return rateBps; }
    public Long getPreviousRateBps() { return previousRateBps; }
    public Long getMarkPrice() { return markPrice; }
    public Long getIndexPrice() { return indexPrice; }
    public Long getIntervals() { return intervals; }
    public Long getPayment() { return payment; }
    public Long getApplied() { return applied; }
}
