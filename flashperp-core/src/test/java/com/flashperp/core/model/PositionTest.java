package com.flashperp.core.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.flashperp.core.math.FixedPointMath.units;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Position state changes.
 */
class PositionTest {

    private static final Instant OPENED = Instant.parse("2026-01-01T00:00:00Z");

    private Position position;

    @BeforeEach
    void setUp() {
        position = new Position(1, "alice", "ETH-PERP", Side.LONG, units(1000), units(1), units(3000), 3, OPENED);
    }

    @Test
    @DisplayName("New position starts its funding clock at open")
    void fundingClockStartsAtOpen() {
        assertEquals(OPENED, position.getLastFundingTime());
        assertEquals(0, position.getAccumulatedFunding());
        assertTrue(position.isOpen());
        assertTrue(position.isOwnedBy("alice"));
        assertFalse(position.isOwnedBy("bob"));
    }

    @Test
    @DisplayName("Copy is detached from the original")
    void copyIsDetached() {
        Position copy = position.copy();
        copy.reduce(units(1), units(1000), OPENED.plusSeconds(60));

        assertEquals(units(1), position.getSize());
        assertEquals(units(1000), position.getCollateral());
        assertFalse(copy.isOpen());
    }

    @Nested
    @DisplayName("Funding")
    class Funding {

        @Test
        @DisplayName("Payment reduces collateral and accumulates")
        void paymentReducesCollateral() {
            Instant settled = OPENED.plusSeconds(8 * 3600);
            position.applyFunding(1_000_000L, settled);

            assertEquals(units(1000) - 1_000_000L, position.getCollateral());
            assertEquals(1_000_000L, position.getAccumulatedFunding());
            assertEquals(settled, position.getLastFundingTime());
        }

        @Test
        @DisplayName("Receipt adds to collateral")
        void receiptAddsCollateral() {
            position.applyFunding(-1_000_000L, OPENED.plusSeconds(1));

            assertEquals(units(1000) + 1_000_000L, position.getCollateral());
            assertEquals(-1_000_000L, position.getAccumulatedFunding());
        }
    }

    @Nested
    @DisplayName("Size Changes")
    class SizeChanges {

        @Test
        @DisplayName("Increase adds size and collateral at the new entry")
        void increase() {
            position.increase(units(1100), units(1), units(3150), OPENED.plusSeconds(5));

            assertEquals(units(2), position.getSize());
            assertEquals(units(2100), position.getCollateral());
            assertEquals(units(3150), position.getEntryPrice());
        }

        @Test
        @DisplayName("Reduce keeps the entry price")
        void reduceKeepsEntry() {
            position.reduce(50_000_000L, units(500), OPENED.plusSeconds(5));

            assertEquals(50_000_000L, position.getSize());
            assertEquals(units(500), position.getCollateral());
            assertEquals(units(3000), position.getEntryPrice());
        }

        @Test
        @DisplayName("Reduce beyond size is rejected")
        void reduceBeyondSize() {
            assertThrows(IllegalArgumentException.class,
                () -> position.reduce(units(2), units(1000), OPENED));
        }
    }
}
