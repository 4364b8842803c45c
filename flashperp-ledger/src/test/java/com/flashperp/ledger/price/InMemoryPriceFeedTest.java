package com.flashperp.ledger.price;

import com.flashperp.ledger.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryPriceFeed.
 */
class InMemoryPriceFeedTest {

    private MutableClock clock;
    private InMemoryPriceFeed feed;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        feed = new InMemoryPriceFeed(clock, Duration.ofMinutes(5));
        feed.addAssetPair("ETH-PERP", 3_030, 3_000);
    }

    @Test
    @DisplayName("Price is the mark price")
    void priceIsMark() throws Exception {
        assertEquals(3_030, feed.price("ETH-PERP"));
        MarkIndexPrices prices = feed.prices("ETH-PERP");
        assertEquals(3_000, prices.indexPrice());
        assertEquals(30, prices.premium());
    }

    @Test
    @DisplayName("Unknown instrument is not supported")
    void unknown() {
        PriceUnavailableException e = assertThrows(PriceUnavailableException.class, () -> feed.price("BTC-PERP"));
        assertEquals(PriceUnavailableException.Reason.NOT_SUPPORTED, e.getReason());
        assertEquals("BTC-PERP", e.getInstrument());
    }

    @Test
    @DisplayName("Prices go stale after the max age and recover on update")
    void staleness() throws Exception {
        clock.advance(Duration.ofMinutes(5));
        assertEquals(3_030, feed.price("ETH-PERP"));

        clock.advance(Duration.ofSeconds(1));
        PriceUnavailableException e = assertThrows(PriceUnavailableException.class, () -> feed.price("ETH-PERP"));
        assertEquals(PriceUnavailableException.Reason.STALE, e.getReason());

        feed.updatePrice("ETH-PERP", 3_100);
        assertEquals(3_100, feed.price("ETH-PERP"));
    }

    @Test
    @DisplayName("Pairs must be added once and updated only when known")
    void pairLifecycle() {
        assertThrows(IllegalArgumentException.class, () -> feed.addAssetPair("ETH-PERP", 1, 1));
        assertThrows(IllegalArgumentException.class, () -> feed.updatePrice("BTC-PERP", 1));
        assertThrows(IllegalArgumentException.class, () -> feed.updatePrice("ETH-PERP", 0));
        assertEquals(List.of("ETH-PERP"), feed.getAssetPairs());
    }
}
