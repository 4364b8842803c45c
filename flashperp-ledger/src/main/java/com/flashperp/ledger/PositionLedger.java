package com.flashperp.ledger;

import com.flashperp.core.exception.InsufficientFundsException;
import com.flashperp.core.exception.LedgerException;
import com.flashperp.core.exception.PreconditionException;
import com.flashperp.core.exception.ValidationException;
import com.flashperp.core.math.FixedPointMath;
import com.flashperp.core.model.CloseResult;
import com.flashperp.core.model.ExchangeParameters;
import com.flashperp.core.model.FundingSettlement;
import com.flashperp.core.model.LiquidationResult;
import com.flashperp.core.model.OpenPositionRequest;
import com.flashperp.core.model.Position;
import com.flashperp.ledger.custody.AssetNotConfiguredException;
import com.flashperp.ledger.custody.Custody;
import com.flashperp.ledger.custody.InsufficientBalanceException;
import com.flashperp.ledger.custody.UnsupportedAssetException;
import com.flashperp.ledger.funding.FundingEngine;
import com.flashperp.ledger.journal.FundingEvent;
import com.flashperp.ledger.journal.LedgerEvent;
import com.flashperp.ledger.journal.LedgerJournal;
import com.flashperp.ledger.journal.PositionEvent;
import com.flashperp.ledger.journal.ShortfallEvent;
import com.flashperp.ledger.liquidation.LiquidationEvaluator;
import com.flashperp.ledger.price.PriceFeed;
import com.flashperp.ledger.price.PriceSnapshot;
import com.flashperp.ledger.price.PriceUnavailableException;
import com.flashperp.ledger.state.AgentRegistry;
import com.flashperp.ledger.state.InstrumentRegistry;
import com.flashperp.ledger.state.InstrumentSlot;
import com.flashperp.ledger.state.ParameterStore;
import com.flashperp.ledger.state.PositionSlot;
import com.flashperp.ledger.state.PositionStore;
import com.flashperp.ledger.state.ShortfallLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Owns open positions and applies open, increase, decrease, close, funding and liquidation to them.
 * <p>
 * Every mutation runs under the position's lock and the instrument's read lock, settles funding
 * first, works on a copy of the position, performs its custody transfers and only then publishes
 * the copy. A failed transfer reverses the transfers already made and leaves the position untouched.
 */
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    @FunctionalInterface
    private interface LockedOperation<T> {
        T apply(PositionSlot slot, Position current, InstrumentSlot instrument) throws LedgerException;
    }

    private final PositionStore positions;
    private final InstrumentRegistry instruments;
    private final ParameterStore parameters;
    private final AgentRegistry agents;
    private final ShortfallLedger shortfalls;
    private final FundingEngine fundingEngine;
    private final LiquidationEvaluator liquidationEvaluator;
    private final Custody custody;
    private final PriceFeed priceFeed;
    private final LedgerJournal journal;
    private final Clock clock;
    private final String treasury;

    public PositionLedger(PositionStore positions, InstrumentRegistry instruments, ParameterStore parameters,
                          AgentRegistry agents, ShortfallLedger shortfalls, FundingEngine fundingEngine,
                          LiquidationEvaluator liquidationEvaluator, Custody custody, PriceFeed priceFeed,
                          LedgerJournal journal, Clock clock, String treasury) {
        this.positions = positions;
        this.instruments = instruments;
        this.parameters = parameters;
        this.agents = agents;
        this.shortfalls = shortfalls;
        this.fundingEngine = fundingEngine;
        this.liquidationEvaluator = liquidationEvaluator;
        this.custody = custody;
        this.priceFeed = priceFeed;
        this.journal = journal;
        this.clock = clock;
        this.treasury = treasury;
    }

    /**
     * Open a position at the current price.
     * Debits collateral plus the taker fee from the owner; the fee goes to the treasury.
     *
     * @return the new position id
     */
    public long open(OpenPositionRequest request) throws LedgerException {
        ExchangeParameters params = parameters.current();
        requireNotPaused();
        validateOpen(request, params);

        InstrumentSlot instrument = requireInstrument(request.instrument());
        if (!positions.claimPair(request.owner(), request.instrument(), params.onePositionPerInstrument())) {
            throw new PreconditionException(PreconditionException.Reason.POSITION_ALREADY_OPEN,
                    String.format("%s already has an open position on %s", request.owner(), request.instrument()));
        }

        boolean committed = false;
        instrument.readLock().lock();
        try {
            Instant now = clock.instant();
            String asset = collateralAsset(request.instrument());
            long price = currentPrice(request.instrument());

            if (!FixedPointMath.withinSlippage(request.referencePrice(), price, request.slippageToleranceBps())) {
                throw new PreconditionException(PreconditionException.Reason.SLIPPAGE_EXCEEDED,
                        String.format("Price %d outside %dbps of reference %d",
                                price, request.slippageToleranceBps(), request.referencePrice()));
            }

            long fundingRate = instrument.getFundingState().globalFundingRate();
            if (fundingRate > request.maxFundingRateBps()) {
                throw new PreconditionException(PreconditionException.Reason.FUNDING_RATE_EXCEEDED,
                        String.format("Funding rate %dbps exceeds max %dbps", fundingRate, request.maxFundingRateBps()));
            }

            long notional = FixedPointMath.notional(request.size(), price);
            long requiredCollateral = notional / request.leverage();
            if (request.collateral() < requiredCollateral) {
                throw new ValidationException(ValidationException.Reason.INSUFFICIENT_MARGIN,
                        String.format("Collateral %d below required %d for %dx on notional %d",
                                request.collateral(), requiredCollateral, request.leverage(), notional));
            }
            long fee = FixedPointMath.tradingFee(notional, params.takerFeeBps());

            TransferBatch transfers = new TransferBatch(custody, asset);
            try {
                transfers.debit(request.owner(), Math.addExact(request.collateral(), fee));
                transfers.credit(treasury, fee);
            } catch (InsufficientBalanceException e) {
                transfers.rollback();
                throw insufficientFunds(request.owner(), Math.addExact(request.collateral(), fee), e);
            } catch (UnsupportedAssetException e) {
                transfers.rollback();
                throw unsupportedAsset(asset, e);
            }

            Position position = new Position(positions.nextId(), request.owner(), request.instrument(),
                    request.side(), request.collateral(), request.size(), price, request.leverage(), now);
            positions.insert(position);
            committed = true;

            journal.append(PositionEvent.opened(position, fee, now));
            log.info("Position opened: #{} {} {} {} size={} collateral={} @ {} ({}x)",
                    position.getId(), position.getOwner(), position.getSide(), position.getInstrument(),
                    position.getSize(), position.getCollateral(), price, position.getLeverage());
            return position.getId();
        } finally {
            instrument.readLock().unlock();
            if (!committed) {
                positions.releasePair(request.owner(), request.instrument());
            }
        }
    }

    /**
     * Close {@code sizeToClose} of a position; closing the full size removes it.
     * The payout is floored at zero and any loss beyond the released collateral is recorded as a shortfall.
     */
    public CloseResult close(long positionId, String caller, long sizeToClose) throws LedgerException {
        ExchangeParameters params = parameters.current();
        requireNotPaused();
        requirePositive(sizeToClose, "sizeToClose");

        return withPosition(positionId, (slot, current, instrument) -> {
            authorize(current, caller);
            if (sizeToClose > current.getSize()) {
                throw new ValidationException(ValidationException.Reason.SIZE_EXCEEDS_POSITION,
                        String.format("Cannot close %d of position #%d with size %d",
                                sizeToClose, positionId, current.getSize()));
            }
            return reduce(slot, current, instrument, sizeToClose, params, ShortfallEvent.Source.CLOSE);
        });
    }

    /**
     * Reduce a position without closing it. {@code sizeToReduce} must be below the current size.
     */
    public CloseResult decrease(long positionId, String caller, long sizeToReduce) throws LedgerException {
        ExchangeParameters params = parameters.current();
        requireNotPaused();
        requirePositive(sizeToReduce, "sizeToReduce");

        return withPosition(positionId, (slot, current, instrument) -> {
            authorize(current, caller);
            if (sizeToReduce >= current.getSize()) {
                throw new ValidationException(ValidationException.Reason.SIZE_EXCEEDS_POSITION,
                        String.format("Decrease of %d would close position #%d with size %d",
                                sizeToReduce, positionId, current.getSize()));
            }
            return reduce(slot, current, instrument, sizeToReduce, params, ShortfallEvent.Source.DECREASE);
        });
    }

    /**
     * Add size and collateral at the current price. The added collateral must cover the added
     * notional at the position's original leverage.
     *
     * @return the updated position
     */
    public Position increase(long positionId, String caller, long additionalCollateral, long additionalSize)
            throws LedgerException {
        ExchangeParameters params = parameters.current();
        requireNotPaused();
        requirePositive(additionalCollateral, "additionalCollateral");
        requirePositive(additionalSize, "additionalSize");

        return withPosition(positionId, (slot, current, instrument) -> {
            authorize(current, caller);
            Instant now = clock.instant();
            String asset = collateralAsset(current.getInstrument());
            long price = currentPrice(current.getInstrument());

            Position working = current.copy();
            FundingSettlement funding = fundingEngine.settle(working, instrument.getFundingState(), now, params);

            long addedNotional = FixedPointMath.notional(additionalSize, price);
            long requiredCollateral = addedNotional / working.getLeverage();
            if (additionalCollateral < requiredCollateral) {
                throw new ValidationException(ValidationException.Reason.INSUFFICIENT_MARGIN,
                        String.format("Added collateral %d below required %d for %dx on added notional %d",
                                additionalCollateral, requiredCollateral, working.getLeverage(), addedNotional));
            }
            long fee = FixedPointMath.tradingFee(addedNotional, params.takerFeeBps());

            TransferBatch transfers = new TransferBatch(custody, asset);
            try {
                transfers.debit(working.getOwner(), Math.addExact(additionalCollateral, fee));
                transfers.credit(treasury, fee);
            } catch (InsufficientBalanceException e) {
                transfers.rollback();
                throw insufficientFunds(working.getOwner(), Math.addExact(additionalCollateral, fee), e);
            } catch (UnsupportedAssetException e) {
                transfers.rollback();
                throw unsupportedAsset(asset, e);
            }

            long newEntry = FixedPointMath.weightedEntryPrice(working.getEntryPrice(), working.getSize(),
                    price, additionalSize);
            working.increase(additionalCollateral, additionalSize, newEntry, now);
            positions.update(slot, working);

            recordFunding(working, funding);
            journal.append(PositionEvent.increased(working, additionalSize, price, fee, now));
            log.info("Position increased: #{} +{} @ {} size={} entry={} collateral={}",
                    positionId, additionalSize, price, working.getSize(), newEntry, working.getCollateral());
            return working.copy();
        });
    }

    /**
     * Settle outstanding funding on a position. Anyone may call this.
     */
    public FundingSettlement applyFunding(long positionId) throws LedgerException {
        ExchangeParameters params = parameters.current();
        requireNotPaused();

        return withPosition(positionId, (slot, current, instrument) -> {
            Position working = current.copy();
            FundingSettlement funding = fundingEngine.settle(working, instrument.getFundingState(),
                    clock.instant(), params);
            if (funding.isApplied()) {
                positions.update(slot, working);
                recordFunding(working, funding);
            }
            return funding;
        });
    }

    /**
     * Liquidate an under-margined position at the current price.
     */
    public LiquidationResult liquidate(long positionId, String liquidator) throws LedgerException {
        return liquidate(positionId, liquidator, null);
    }

    /**
     * Liquidate at a pinned price, so the check and the liquidation agree.
     * Outstanding funding is settled before the margin check.
     * The snapshot must be for the position's instrument and no older than the configured max price age.
     * <p>
     * The liquidator receives {@code min(liquidationFee, remaining)}, the owner the rest of
     * {@code max(0, collateral + pnl)}. The whole position is closed.
     */
    public LiquidationResult liquidate(long positionId, String liquidator, PriceSnapshot pinned)
            throws LedgerException {
        ExchangeParameters params = parameters.current();
        requireNotPaused();
        requireAccount(liquidator, "liquidator");

        return withPosition(positionId, (slot, current, instrument) -> {
            Instant now = clock.instant();
            PriceSnapshot snapshot = pinned != null
                    ? verifySnapshot(pinned, current, now, params)
                    : liquidationEvaluator.snapshot(current.getInstrument());
            long price = snapshot.price();

            Position working = current.copy();
            FundingSettlement funding = fundingEngine.settle(working, instrument.getFundingState(), now, params);
            if (!liquidationEvaluator.isLiquidatable(working, price, params)) {
                throw new PreconditionException(PreconditionException.Reason.NOT_LIQUIDATABLE,
                        String.format("Position #%d is not liquidatable at %d", positionId, price));
            }
            String asset = collateralAsset(working.getInstrument());

            long pnl = FixedPointMath.pnl(working.getSize(), working.getEntryPrice(), price, working.getSide());
            long net = Math.addExact(working.getCollateral(), pnl);
            long remaining = Math.max(0, net);
            long shortfall = Math.max(0, Math.negateExact(net));
            long notional = FixedPointMath.notional(working.getSize(), price);
            long fee = Math.min(FixedPointMath.requiredMargin(notional, params.liquidationFeeBps()), remaining);
            long ownerPayout = remaining - fee;

            TransferBatch transfers = new TransferBatch(custody, asset);
            try {
                // fee credit goes last
                transfers.credit(working.getOwner(), ownerPayout);
                transfers.credit(liquidator, fee);
            } catch (UnsupportedAssetException e) {
                transfers.rollback();
                throw unsupportedAsset(asset, e);
            }

            positions.remove(slot, working);

            recordFunding(working, funding);
            recordShortfall(ShortfallEvent.Source.LIQUIDATION, working, shortfall, now);
            journal.append(PositionEvent.liquidated(working, price, pnl, fee, ownerPayout, liquidator, now));
            log.warn("Position liquidated: #{} {} {} size={} @ {} pnl={} fee={} ownerPayout={} by {}",
                    positionId, working.getOwner(), working.getInstrument(), working.getSize(), price,
                    pnl, fee, ownerPayout, liquidator);

            return new LiquidationResult(positionId, liquidator, price, pnl, remaining, fee, ownerPayout,
                    shortfall, funding);
        });
    }

    /**
     * Let {@code agent} close, increase and decrease positions of {@code owner}.
     */
    public void authorizeAgent(String owner, String agent) throws ValidationException {
        requireAccount(owner, "owner");
        requireAccount(agent, "agent");
        agents.authorize(owner, agent);
        log.info("Agent {} authorized for {}", agent, owner);
    }

    public void revokeAgent(String owner, String agent) {
        agents.revoke(owner, agent);
        log.info("Agent {} revoked for {}", agent, owner);
    }

    public Optional<Position> getPosition(long positionId) {
        return positions.find(positionId);
    }

    public List<Position> getOpenPositions() {
        return positions.all();
    }

    public List<Position> getOpenPositions(String instrument) {
        return positions.byInstrument(instrument);
    }

    public List<Position> getPositionsFor(String owner) {
        return positions.byOwner(owner);
    }

    /**
     * Journaled history of an open position from the day it was opened through today.
     */
    public List<LedgerEvent> getHistory(long positionId) throws PreconditionException {
        Position position = positions.find(positionId).orElseThrow(() -> notFound(positionId));
        return journal.positionHistory(positionId,
                LocalDate.ofInstant(position.getOpenedAt(), ZoneOffset.UTC),
                LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC));
    }

    /**
     * Losses on {@code instrument} that could not be collected from traders.
     */
    public long recordedShortfall(String instrument) {
        return shortfalls.total(instrument);
    }

    public String getTreasury() {
        return treasury;
    }

    private CloseResult reduce(PositionSlot slot, Position current, InstrumentSlot instrument, long sizeRemoved,
                               ExchangeParameters params, ShortfallEvent.Source source) throws LedgerException {
        Instant now = clock.instant();
        String asset = collateralAsset(current.getInstrument());
        long price = currentPrice(current.getInstrument());

        Position working = current.copy();
        FundingSettlement funding = fundingEngine.settle(working, instrument.getFundingState(), now, params);

        // released collateral is proportional to the size removed, taken before PnL
        long pnl = FixedPointMath.pnl(sizeRemoved, working.getEntryPrice(), price, working.getSide());
        long collateralReturned = FixedPointMath.proportional(working.getCollateral(), sizeRemoved, working.getSize());
        boolean fullyClosed = sizeRemoved == working.getSize();
        working.reduce(sizeRemoved, collateralReturned, now);

        long net = Math.addExact(collateralReturned, pnl);
        long payout = Math.max(0, net);
        long shortfall = Math.max(0, Math.negateExact(net));

        TransferBatch transfers = new TransferBatch(custody, asset);
        try {
            transfers.credit(working.getOwner(), payout);
        } catch (UnsupportedAssetException e) {
            transfers.rollback();
            throw unsupportedAsset(asset, e);
        }

        if (fullyClosed) {
            positions.remove(slot, working);
        } else {
            positions.update(slot, working);
        }

        recordFunding(working, funding);
        recordShortfall(source, working, shortfall, now);
        journal.append(PositionEvent.reduced(working, sizeRemoved, price, pnl, payout, fullyClosed, now));
        log.info("Position {}: #{} -{} @ {} pnl={} collateralReturned={} payout={}",
                fullyClosed ? "closed" : "decreased", working.getId(), sizeRemoved, price, pnl,
                collateralReturned, payout);

        return new CloseResult(working.getId(), sizeRemoved, price, pnl, collateralReturned, payout, shortfall,
                funding, fullyClosed);
    }

    private <T> T withPosition(long positionId, LockedOperation<T> operation) throws LedgerException {
        PositionSlot slot = positions.slot(positionId).orElseThrow(() -> notFound(positionId));
        slot.lock();
        try {
            // re-read under the lock: the position may have closed while we waited
            Position current = slot.current().orElseThrow(() -> notFound(positionId));
            InstrumentSlot instrument = requireInstrument(current.getInstrument());
            instrument.readLock().lock();
            try {
                return operation.apply(slot, current, instrument);
            } finally {
                instrument.readLock().unlock();
            }
        } finally {
            slot.unlock();
        }
    }

    private void recordFunding(Position position, FundingSettlement funding) {
        if (!funding.isApplied()) {
            return;
        }
        journal.append(FundingEvent.settled(position, funding));
        recordShortfall(ShortfallEvent.Source.FUNDING, position, funding.unpaid(), funding.settledAt());
    }

    private void recordShortfall(ShortfallEvent.Source source, Position position, long amount, Instant at) {
        if (amount <= 0) {
            return;
        }
        shortfalls.record(position.getInstrument(), amount);
        journal.append(new ShortfallEvent(source, position.getId(), position.getOwner(), position.getInstrument(),
                amount, at));
        log.error("SHORTFALL {} on #{} {} {}: {} could not be collected (total {})",
                source, position.getId(), position.getOwner(), position.getInstrument(), amount,
                shortfalls.total(position.getInstrument()));
    }

    private PriceSnapshot verifySnapshot(PriceSnapshot snapshot, Position position, Instant now,
                                         ExchangeParameters params) throws PreconditionException {
        if (!snapshot.instrument().equals(position.getInstrument())) {
            throw new PreconditionException(PreconditionException.Reason.STALE_SNAPSHOT,
                    String.format("Snapshot is for %s, position #%d is on %s",
                            snapshot.instrument(), position.getId(), position.getInstrument()));
        }
        if (snapshot.isOlderThan(params.maxPriceAge(), now)) {
            throw new PreconditionException(PreconditionException.Reason.STALE_SNAPSHOT,
                    String.format("Snapshot for %s taken at %s is older than %s",
                            snapshot.instrument(), snapshot.observedAt(), params.maxPriceAge()));
        }
        return snapshot;
    }

    private void validateOpen(OpenPositionRequest request, ExchangeParameters params) throws ValidationException {
        requireAccount(request.owner(), "owner");
        if (request.side() == null) {
            throw new ValidationException(ValidationException.Reason.MISSING_FIELD, "side is required");
        }
        if (request.instrument() == null) {
            throw new ValidationException(ValidationException.Reason.MISSING_FIELD, "instrument is required");
        }
        requirePositive(request.collateral(), "collateral");
        requirePositive(request.size(), "size");
        requirePositive(request.referencePrice(), "referencePrice");
        if (request.leverage() < 1 || request.leverage() > params.maxLeverage()) {
            throw new ValidationException(ValidationException.Reason.LEVERAGE_OUT_OF_RANGE,
                    String.format("Leverage %d outside [1, %d]", request.leverage(), params.maxLeverage()));
        }
        if (request.slippageToleranceBps() < 0) {
            throw new ValidationException(ValidationException.Reason.ZERO_AMOUNT,
                    "slippageToleranceBps must not be negative");
        }
    }

    private void authorize(Position position, String caller) throws PreconditionException {
        if (!agents.mayActFor(caller, position.getOwner())) {
            throw new PreconditionException(PreconditionException.Reason.UNAUTHORIZED,
                    String.format("%s may not act on position #%d of %s", caller, position.getId(), position.getOwner()));
        }
    }

    private void requireNotPaused() throws PreconditionException {
        if (parameters.isPaused()) {
            throw new PreconditionException(PreconditionException.Reason.PAUSED, "Exchange is paused");
        }
    }

    private InstrumentSlot requireInstrument(String instrument) throws PreconditionException {
        return instruments.find(instrument)
                .orElseThrow(() -> new PreconditionException(PreconditionException.Reason.UNSUPPORTED_INSTRUMENT,
                        "Unsupported instrument: " + instrument));
    }

    private String collateralAsset(String instrument) throws PreconditionException {
        try {
            return custody.collateralAssetFor(instrument);
        } catch (AssetNotConfiguredException e) {
            throw new PreconditionException(PreconditionException.Reason.UNSUPPORTED_ASSET, e.getMessage(), e);
        }
    }

    private long currentPrice(String instrument) throws PreconditionException {
        try {
            return priceFeed.price(instrument);
        } catch (PriceUnavailableException e) {
            throw new PreconditionException(PreconditionException.Reason.PRICE_UNAVAILABLE,
                    "Price unavailable for " + instrument + ": " + e.getMessage(), e);
        }
    }

    private static void requirePositive(long amount, String name) throws ValidationException {
        if (amount <= 0) {
            throw new ValidationException(ValidationException.Reason.ZERO_AMOUNT, name + " must be positive: " + amount);
        }
    }

    private static void requireAccount(String account, String name) throws ValidationException {
        if (account == null || account.isBlank()) {
            throw new ValidationException(ValidationException.Reason.INVALID_ACCOUNT, name + " is required");
        }
    }

    private static PreconditionException notFound(long positionId) {
        return new PreconditionException(PreconditionException.Reason.POSITION_NOT_FOUND,
                "Position not found: " + positionId);
    }

    private static PreconditionException unsupportedAsset(String asset, UnsupportedAssetException e) {
        return new PreconditionException(PreconditionException.Reason.UNSUPPORTED_ASSET,
                "Custody does not support " + asset, e);
    }

    private static InsufficientFundsException insufficientFunds(String owner, long amount,
                                                                InsufficientBalanceException e) {
        return new InsufficientFundsException(owner, amount, e.getMessage(), e);
    }
}
