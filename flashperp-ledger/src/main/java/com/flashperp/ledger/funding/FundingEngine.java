package com.flashperp.ledger.funding;

import com.flashperp.core.exception.PreconditionException;
import com.flashperp.core.math.FixedPointMath;
import com.flashperp.core.model.ExchangeParameters;
import com.flashperp.core.model.FundingSettlement;
import com.flashperp.core.model.FundingSettlementPolicy;
import com.flashperp.core.model.InstrumentFundingState;
import com.flashperp.core.model.Position;
import com.flashperp.ledger.journal.FundingEvent;
import com.flashperp.ledger.journal.LedgerJournal;
import com.flashperp.ledger.price.MarkIndexPrices;
import com.flashperp.ledger.price.PriceFeed;
import com.flashperp.ledger.price.PriceUnavailableException;
import com.flashperp.ledger.state.InstrumentRegistry;
import com.flashperp.ledger.state.InstrumentSlot;
import com.flashperp.ledger.state.ParameterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Recomputes per-instrument funding rates on a fixed cadence and settles funding on positions.
 *
 * Rates are basis points per funding interval, derived from the mark/index premium:
 * - positive rate: longs pay shorts
 * - negative rate: shorts pay longs
 */
public class FundingEngine {

    private static final Logger log = LoggerFactory.getLogger(FundingEngine.class);

    private final InstrumentRegistry instruments;
    private final PriceFeed priceFeed;
    private final ParameterStore parameters;
    private final LedgerJournal journal;
    private final Clock clock;

    public FundingEngine(InstrumentRegistry instruments, PriceFeed priceFeed, ParameterStore parameters,
                         LedgerJournal journal, Clock clock) {
        this.instruments = instruments;
        this.priceFeed = priceFeed;
        this.parameters = parameters;
        this.journal = journal;
        this.clock = clock;
    }

    /**
     * Refresh the funding rate of every instrument whose interval has elapsed.
     * Instruments not yet due are left untouched, so a second call inside one interval is a no-op.
     * Only the instrument being updated is locked; a price failure skips that instrument.
     *
     * @return instruments whose rate was updated
     */
    public List<String> updateFundingRates() throws PreconditionException {
        if (parameters.isPaused()) {
            throw new PreconditionException(PreconditionException.Reason.PAUSED, "Exchange is paused");
        }
        ExchangeParameters params = parameters.current();
        Instant now = clock.instant();
        List<String> updated = new ArrayList<>();

        for (InstrumentSlot slot : instruments.slots()) {
            slot.writeLock().lock();
            try {
                if (updateIfDue(slot, params, now)) {
                    updated.add(slot.getInstrument());
                }
            } catch (PriceUnavailableException e) {
                log.warn("Skipping funding update for {}: {}", slot.getInstrument(), e.getMessage());
            } finally {
                slot.writeLock().unlock();
            }
        }

        if (!updated.isEmpty()) {
            log.info("Funding rates updated for {} of {} instruments", updated.size(), instruments.size());
        }
        return updated;
    }

    private boolean updateIfDue(InstrumentSlot slot, ExchangeParameters params, Instant now)
            throws PriceUnavailableException {
        InstrumentFundingState state = slot.getFundingState();
        if (!state.isDue(now, params.fundingInterval())) {
            return false;
        }
        MarkIndexPrices prices = priceFeed.prices(slot.getInstrument());
        long rate = FixedPointMath.fundingRate(prices.markPrice(), prices.indexPrice(), params.fundingRateFactor());
        slot.updateFundingState(state.withRate(rate, now));

        journal.append(FundingEvent.rateUpdated(slot.getInstrument(), state.globalFundingRate(), rate,
                prices.markPrice(), prices.indexPrice(), now));
        log.info("Funding rate {}: {}bps -> {}bps (mark={} index={})",
                slot.getInstrument(), state.globalFundingRate(), rate, prices.markPrice(), prices.indexPrice());
        return true;
    }

    /**
     * Settle funding on a working copy of a position.
     * <p>
     * No-op when {@code now} is not after the last settlement or no whole interval has elapsed.
     * Otherwise charges {@code rate * intervals} and moves the last funding time to {@code now}.
     * Under {@link FundingSettlementPolicy#CLAMP_AT_ZERO} a payment larger than the collateral
     * takes the collateral to zero and reports the rest as unpaid.
     */
    public FundingSettlement settle(Position working, InstrumentFundingState state, Instant now,
                                    ExchangeParameters params) {
        Instant last = working.getLastFundingTime();
        if (!now.isAfter(last)) {
            return FundingSettlement.none(working.getId(), last);
        }
        long intervals = Duration.between(last, now).dividedBy(params.fundingInterval());
        if (intervals == 0) {
            return FundingSettlement.none(working.getId(), last);
        }

        long rate = Math.multiplyExact(state.globalFundingRate(), intervals);
        long payment = FixedPointMath.fundingPayment(working.getSize(), rate, working.getSide());

        long applied = payment;
        long unpaid = 0;
        if (params.fundingSettlementPolicy() == FundingSettlementPolicy.CLAMP_AT_ZERO
                && payment > working.getCollateral()) {
            applied = Math.max(0, working.getCollateral());
            unpaid = payment - applied;
        }
        working.applyFunding(applied, now);

        log.debug("Funding settled #{}: {}bps x{} payment={} applied={}",
                working.getId(), state.globalFundingRate(), intervals, payment, applied);
        return new FundingSettlement(working.getId(), intervals, rate, payment, applied, unpaid, now);
    }

    /**
     * Current funding state of an instrument.
     */
    public InstrumentFundingState fundingState(String instrument) throws PreconditionException {
        return instruments.find(instrument)
                .map(InstrumentSlot::getFundingState)
                .orElseThrow(() -> new PreconditionException(PreconditionException.Reason.UNSUPPORTED_INSTRUMENT,
                        "Unsupported instrument: " + instrument));
    }
}
