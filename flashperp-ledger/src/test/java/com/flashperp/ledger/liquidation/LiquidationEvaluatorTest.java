package com.flashperp.ledger.liquidation;

import com.flashperp.core.exception.PreconditionException;
import com.flashperp.core.model.Side;
import com.flashperp.ledger.ExchangeFixture;
import com.flashperp.ledger.price.PriceSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.OptionalLong;

import static com.flashperp.core.math.FixedPointMath.units;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LiquidationEvaluator.
 */
class LiquidationEvaluatorTest {

    @TempDir
    Path tempDir;

    private ExchangeFixture ex;
    private LiquidationEvaluator evaluator;
    private long id;

    @BeforeEach
    void setUp() throws Exception {
        ex = ExchangeFixture.create(tempDir);
        ex.deposit("alice", units(3000));
        evaluator = ex.exchange.getLiquidationEvaluator();
        id = ex.open("alice", Side.LONG, units(1000), units(1), 3);
    }

    @Test
    @DisplayName("Healthy position is not liquidatable")
    void healthy() throws Exception {
        assertFalse(evaluator.isLiquidatable(id));
    }

    @Test
    @DisplayName("Exactly at maintenance margin is not liquidatable, one tick below is")
    void boundary() {
        long liquidationPrice = evaluator.liquidationPrice(id).orElseThrow();
        assertEquals(204_081_632_653L, liquidationPrice);

        PriceSnapshot atMargin = new PriceSnapshot(ExchangeFixture.INSTRUMENT, liquidationPrice, ex.clock.instant());
        PriceSnapshot below = new PriceSnapshot(ExchangeFixture.INSTRUMENT, liquidationPrice - 1, ex.clock.instant());

        assertFalse(evaluator.isLiquidatable(id, atMargin));
        assertTrue(evaluator.isLiquidatable(id, below));
    }

    @Test
    @DisplayName("Effective collateral is floored at zero")
    void effectiveCollateralFloor() {
        var position = ex.ledger.getPosition(id).orElseThrow();
        assertEquals(units(500), evaluator.effectiveCollateral(position, units(2500)));
        assertEquals(0, evaluator.effectiveCollateral(position, units(1000)));
    }

    @Test
    @DisplayName("Maintenance margin follows the current notional")
    void maintenanceMargin() {
        var position = ex.ledger.getPosition(id).orElseThrow();
        assertEquals(units(50), evaluator.maintenanceMargin(position, units(2500),
            ex.exchange.getAdmin().getParameters()));
    }

    @Test
    @DisplayName("Unknown position is never liquidatable")
    void unknownPosition() throws Exception {
        assertFalse(evaluator.isLiquidatable(99));
        assertTrue(evaluator.liquidationPrice(99).isEmpty());
    }

    @Test
    @DisplayName("Snapshot for another instrument does not match")
    void otherInstrumentSnapshot() {
        PriceSnapshot other = new PriceSnapshot("BTC-PERP", 1, ex.clock.instant());
        assertFalse(evaluator.isLiquidatable(id, other));
    }

    @Test
    @DisplayName("Snapshot reads the current mark price")
    void snapshot() throws Exception {
        ex.setPrice(units(2000));
        PriceSnapshot snapshot = evaluator.snapshot(ExchangeFixture.INSTRUMENT);

        assertEquals(units(2000), snapshot.price());
        assertEquals(ex.clock.instant(), snapshot.observedAt());
        assertTrue(evaluator.isLiquidatable(id));
    }

    @Test
    @DisplayName("Missing price is reported as a precondition failure")
    void missingPrice() {
        PreconditionException e = assertThrows(PreconditionException.class,
            () -> evaluator.snapshot("BTC-PERP"));
        assertEquals(PreconditionException.Reason.PRICE_UNAVAILABLE, e.getReason());
    }

    @Test
    @DisplayName("Short liquidation price lies above entry")
    void shortLiquidationPrice() throws Exception {
        long shortId = ex.open("alice", Side.SHORT, units(1000), units(1), 3);
        OptionalLong price = evaluator.liquidationPrice(shortId);
        assertEquals(392_156_862_745L, price.orElseThrow());
    }
}
