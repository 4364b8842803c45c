package com.flashperp.ledger.journal;

import com.flashperp.core.model.Position;
import com.flashperp.core.model.Side;

import java.time.Instant;

/**
 * Journal event for position lifecycle (opened, increased, decreased, closed, liquidated).
 */
public class PositionEvent extends LedgerEvent {

    private String action;
    private long positionId;
    private String owner;
    private String instrument;
    private Side side;
    private long size;
    private long collateral;
    private long entryPrice;
    private int leverage;
    private long price;
    private Long sizeChange;
    private Long realizedPnl;
    private Long payout;
    private Long fee;
    private String liquidator;

    // For Jackson
    public PositionEvent() {}

    private PositionEvent(String action, Position position, long price, Instant at) {
        super(at);
        this.action = action;
        this.positionId = position.getId();
        this.owner = position.getOwner();
        this.instrument = position.getInstrument();
        this.side = position.getSide();
        this.size = position.getSize();
        this.collateral = position.getCollateral();
        this.entryPrice = position.getEntryPrice();
        this.leverage = position.getLeverage();
        this.price = price;
    }

    public static PositionEvent opened(Position position, long fee, Instant at) {
        PositionEvent event = new PositionEvent("opened", position, position.getEntryPrice(), at);
        event.sizeChange = position.getSize();
        event.fee = fee;
        return event;
    }

    public static PositionEvent increased(Position position, long addedSize, long price, long fee, Instant at) {
        PositionEvent event = new PositionEvent("increased", position, price, at);
        event.sizeChange = addedSize;
        event.fee = fee;
        return event;
    }

    /**
     * Decrease or close. {@code position} is the state after the reduction (size 0 when closed).
     */
    public static PositionEvent reduced(Position position, long removedSize, long price,
                                        long realizedPnl, long payout, boolean closed, Instant at) {
        PositionEvent event = new PositionEvent(closed ? "closed" : "decreased", position, price, at);
        event.sizeChange = -removedSize;
        event.realizedPnl = realizedPnl;
        event.payout = payout;
        return event;
    }

    public static PositionEvent liquidated(Position position, long price, long pnl, long fee,
                                           long ownerPayout, String liquidator, Instant at) {
        PositionEvent event = new PositionEvent("liquidated", position, price, at);
        event.sizeChange = -position.getSize();
        event.realizedPnl = pnl;
        event.fee = fee;
        event.payout = ownerPayout;
        event.liquidator = liquidator;
        return event;
    }

    @Override
    public String getEventType() { return "position"; }

    @Override
    public boolean concerns(long id) {
        return positionId == id;
    }

    @Override
    public String getSummary() {
        if (realizedPnl != null) {
            return String.format("[%s] #%d %s %s %s PnL=%d payout=%d",
                    action, positionId, owner, instrument, side, realizedPnl, payout);
        }
        return String.format("[%s] #%d %s %s %s size=%d @ %d",
                action, positionId, owner, instrument, side, size, entryPrice);
    }

    // Getters for Jackson
    public String getAction() { return action; }
    public long getPositionId() { return positionId; }
    public String getOwner() { return owner; }
    public String getInstrument() { return instrument; }
    public Side getSide() { return side; }
    public long getSize() { return size; }
    public long getCollateral() { return collateral; }
    public long getEntryPrice() { return entryPrice; }
    public int getLeverage() { return leverage; }
    public long getPrice() { return price; }
    public Long getSizeChange() { return sizeChange; }
    public Long getRealizedPnl() { return realizedPnl; }
    public Long getPayout() { return payout; }
    public Long getFee() { return fee; }
    public String getLiquidator() { return liquidator; }
}
