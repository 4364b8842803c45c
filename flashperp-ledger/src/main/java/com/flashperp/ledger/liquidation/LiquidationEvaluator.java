package com.flashperp.ledger.liquidation;

import com.flashperp.core.exception.PreconditionException;
import com.flashperp.core.math.FixedPointMath;
import com.flashperp.core.model.ExchangeParameters;
import com.flashperp.core.model.Position;
import com.flashperp.ledger.price.PriceFeed;
import com.flashperp.ledger.price.PriceSnapshot;
import com.flashperp.ledger.price.PriceUnavailableException;
import com.flashperp.ledger.state.ParameterStore;
import com.flashperp.ledger.state.PositionStore;

import java.time.Clock;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Decides whether a position is under its maintenance margin.
 * <p>
 * A position is liquidatable when {@code max(0, collateral + pnl)} is below
 * {@code maintenanceMarginBps * notional(size, price) / 10000}. Callers that check and then act
 * should take a {@link #snapshot(String)} and pass the same price to both steps.
 */
public class LiquidationEvaluator {

    private final PositionStore positions;
    private final PriceFeed priceFeed;
    private final ParameterStore parameters;
    private final Clock clock;

    public LiquidationEvaluator(PositionStore positions, PriceFeed priceFeed, ParameterStore parameters, Clock clock) {
        this.positions = positions;
        this.priceFeed = priceFeed;
        this.parameters = parameters;
        this.clock = clock;
    }

    /**
     * False when the position does not exist. Reads the current price.
     */
    public boolean isLiquidatable(long positionId) throws PreconditionException {
        Optional<Position> position = positions.find(positionId);
        if (position.isEmpty()) {
            return false;
        }
        PriceSnapshot snapshot = snapshot(position.get().getInstrument());
        return isLiquidatable(position.get(), snapshot.price(), parameters.current());
    }

    /**
     * Check against a pinned price.
     */
    public boolean isLiquidatable(long positionId, PriceSnapshot snapshot) {
        return positions.find(positionId)
                .filter(p -> p.getInstrument().equals(snapshot.instrument()))
                .map(p -> isLiquidatable(p, snapshot.price(), parameters.current()))
                .orElse(false);
    }

    public boolean isLiquidatable(Position position, long price, ExchangeParameters params) {
        return effectiveCollateral(position, price) < maintenanceMargin(position, price, params);
    }

    /**
     * {@code max(0, collateral + pnl)} at {@code price}.
     */
    public long effectiveCollateral(Position position, long price) {
        long pnl = FixedPointMath.pnl(position.getSize(), position.getEntryPrice(), price, position.getSide());
        return Math.max(0, Math.addExact(position.getCollateral(), pnl));
    }

    public long maintenanceMargin(Position position, long price, ExchangeParameters params) {
        long notional = FixedPointMath.notional(position.getSize(), price);
        return FixedPointMath.requiredMargin(notional, params.maintenanceMarginBps());
    }

    /**
     * Estimated liquidation price of an open position, empty if it does not exist.
     */
    public OptionalLong liquidationPrice(long positionId) {
        Optional<Position> position = positions.find(positionId);
        if (position.isEmpty()) {
            return OptionalLong.empty();
        }
        Position p = position.get();
        return OptionalLong.of(FixedPointMath.liquidationPrice(p.getSize(), p.getCollateral(), p.getEntryPrice(),
                parameters.current().maintenanceMarginBps(), p.getSide()));
    }

    /**
     * Read the current mark price once for check-then-act use.
     */
    public PriceSnapshot snapshot(String instrument) throws PreconditionException {
        try {
            return new PriceSnapshot(instrument, priceFeed.price(instrument), clock.instant());
        } catch (PriceUnavailableException e) {
            throw new PreconditionException(PreconditionException.Reason.PRICE_UNAVAILABLE,
                    "Price unavailable for " + instrument + ": " + e.getMessage(), e);
        }
    }
}
