package com.flashperp.ledger.funding;

import com.flashperp.core.exception.PreconditionException;
import com.flashperp.core.model.ExchangeParameters;
import com.flashperp.core.model.FundingSettlement;
import com.flashperp.core.model.FundingSettlementPolicy;
import com.flashperp.core.model.InstrumentFundingState;
import com.flashperp.core.model.Position;
import com.flashperp.core.model.Side;
import com.flashperp.ledger.ExchangeFixture;
import com.flashperp.ledger.journal.FundingEvent;
import com.flashperp.ledger.journal.LedgerEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.flashperp.core.math.FixedPointMath.units;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FundingEngine rate sweeps and per-position settlement.
 */
class FundingEngineTest {

    @TempDir
    Path tempDir;

    private ExchangeFixture ex;
    private FundingEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        ex = ExchangeFixture.create(tempDir);
        engine = ex.exchange.getFundingEngine();
    }

    @Nested
    @DisplayName("Rate Sweep")
    class RateSweep {

        @Test
        @DisplayName("Nothing is updated before the first interval elapses")
        void notDueYet() throws Exception {
            ex.clock.advance(Duration.ofHours(7));
            assertTrue(engine.updateFundingRates().isEmpty());
            assertEquals(0, engine.fundingState(ExchangeFixture.INSTRUMENT).globalFundingRate());
        }

        @Test
        @DisplayName("Due instrument gets the mark/index rate")
        void updatesWhenDue() throws Exception {
            ex.clock.advance(Duration.ofHours(8));
            ex.prices.updatePrice(ExchangeFixture.INSTRUMENT, units(3030), units(3000));

            List<String> updated = engine.updateFundingRates();

            assertEquals(List.of(ExchangeFixture.INSTRUMENT), updated);
            InstrumentFundingState state = engine.fundingState(ExchangeFixture.INSTRUMENT);
            assertEquals(10, state.globalFundingRate());
            assertEquals(ex.clock.instant(), state.lastFundingUpdateTime());
        }

        @Test
        @DisplayName("Second sweep in the same interval changes nothing")
        void idempotentWithinInterval() throws Exception {
            ex.clock.advance(Duration.ofHours(8));
            ex.prices.updatePrice(ExchangeFixture.INSTRUMENT, units(3030), units(3000));
            engine.updateFundingRates();

            ex.prices.updatePrice(ExchangeFixture.INSTRUMENT, units(2970), units(3000));
            ex.clock.advance(Duration.ofHours(1));

            assertTrue(engine.updateFundingRates().isEmpty());
            assertEquals(10, engine.fundingState(ExchangeFixture.INSTRUMENT).globalFundingRate());
        }

        @Test
        @DisplayName("Rate update is journaled")
        void journaled() throws Exception {
            ex.clock.advance(Duration.ofHours(8));
            ex.prices.updatePrice(ExchangeFixture.INSTRUMENT, units(2970), units(3000));
            engine.updateFundingRates();

            List<LedgerEvent> events = ex.exchange.getJournal().readToday();
            FundingEvent event = (FundingEvent) events.get(events.size() - 1);
            assertEquals("rate_updated", event.getAction());
            assertEquals(-10, event.getRateBps());
            assertEquals(0L, event.getPreviousRateBps());
        }

        @Test
        @DisplayName("Paused exchange refuses the sweep")
        void paused() {
            ex.exchange.getAdmin().pause();
            PreconditionException e = assertThrows(PreconditionException.class, () -> engine.updateFundingRates());
            assertEquals(PreconditionException.Reason.PAUSED, e.getReason());
        }

        @Test
        @DisplayName("Unknown instrument state is reported")
        void unknownInstrument() {
            PreconditionException e = assertThrows(PreconditionException.class,
                () -> engine.fundingState("BTC-PERP"));
            assertEquals(PreconditionException.Reason.UNSUPPORTED_INSTRUMENT, e.getReason());
        }
    }

    @Nested
    @DisplayName("Settlement")
    class Settlement {

        private final Instant opened = ExchangeFixture.START;
        private final ExchangeParameters params = ExchangeParameters.defaults();

        private Position position(Side side, long collateral) {
            return new Position(1, "alice", ExchangeFixture.INSTRUMENT, side, collateral, units(1), units(3000), 3, opened);
        }

        private InstrumentFundingState rate(long bps) {
            return new InstrumentFundingState(ExchangeFixture.INSTRUMENT, bps, opened);
        }

        @Test
        @DisplayName("Less than one interval settles nothing")
        void partialInterval() {
            Position p = position(Side.LONG, units(1000));
            FundingSettlement s = engine.settle(p, rate(100), opened.plus(Duration.ofHours(7)), params);

            assertFalse(s.isApplied());
            assertEquals(opened, p.getLastFundingTime());
        }

        @Test
        @DisplayName("Rate applies once per elapsed interval")
        void multipleIntervals() {
            Position p = position(Side.LONG, units(1000));
            FundingSettlement s = engine.settle(p, rate(100), opened.plus(Duration.ofHours(17)), params);

            assertEquals(2, s.intervals());
            assertEquals(200, s.rateBps());
            assertEquals(2_000_000L, s.applied());
            assertEquals(units(1000) - 2_000_000L, p.getCollateral());
        }

        @Test
        @DisplayName("Short receives a positive rate")
        void shortReceives() {
            Position p = position(Side.SHORT, units(1000));
            FundingSettlement s = engine.settle(p, rate(100), opened.plus(Duration.ofHours(8)), params);

            assertEquals(-1_000_000L, s.applied());
            assertEquals(units(1000) + 1_000_000L, p.getCollateral());
        }

        @Test
        @DisplayName("Clamp policy stops collateral at zero")
        void clampAtZero() {
            Position p = position(Side.LONG, 500_000L);
            FundingSettlement s = engine.settle(p, rate(100), opened.plus(Duration.ofHours(8)), params);

            assertEquals(1_000_000L, s.payment());
            assertEquals(500_000L, s.applied());
            assertEquals(500_000L, s.unpaid());
            assertEquals(0, p.getCollateral());
        }

        @Test
        @DisplayName("Allow-negative policy lets collateral go below zero")
        void allowNegative() {
            ExchangeParameters negative = params.toBuilder()
                .fundingSettlementPolicy(FundingSettlementPolicy.ALLOW_NEGATIVE).build();
            Position p = position(Side.LONG, 500_000L);
            FundingSettlement s = engine.settle(p, rate(100), opened.plus(Duration.ofHours(8)), negative);

            assertEquals(1_000_000L, s.applied());
            assertEquals(0, s.unpaid());
            assertEquals(-500_000L, p.getCollateral());
        }
    }
}
