package com.flashperp.ledger.price;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Price oracle fed by explicit updates. Prices older than {@code maxAge} are reported stale.
 */
public class InMemoryPriceFeed implements PriceFeed {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPriceFeed.class);

    private final Clock clock;
    private volatile Duration maxAge;
    private final Map<String, MarkIndexPrices> prices = new ConcurrentHashMap<>();

    public InMemoryPriceFeed(Clock clock, Duration maxAge) {
        this.clock = clock;
        this.maxAge = maxAge;
    }

    /**
     * Register an instrument with its initial prices.
     */
    public void addAssetPair(String instrument, long markPrice, long indexPrice) {
        if (prices.containsKey(instrument)) {
            throw new IllegalArgumentException("Asset pair already exists: " + instrument);
        }
        store(instrument, markPrice, indexPrice);
        log.info("Asset pair added: {} mark={} index={}", instrument, markPrice, indexPrice);
    }

    public void updatePrice(String instrument, long markPrice, long indexPrice) {
        if (!prices.containsKey(instrument)) {
            throw new IllegalArgumentException("Unknown asset pair: " + instrument);
        }
        store(instrument, markPrice, indexPrice);
        log.debug("Price updated: {} mark={} index={}", instrument, markPrice, indexPrice);
    }

    /**
     * Set mark and index to the same value.
     */
    public void updatePrice(String instrument, long price) {
        updatePrice(instrument, price, price);
    }

    public void setMaxAge(Duration maxAge) {
        this.maxAge = maxAge;
    }

    public List<String> getAssetPairs() {
        return prices.keySet().stream().sorted().toList();
    }

    @Override
    public long price(String instrument) throws PriceUnavailableException {
        return prices(instrument).markPrice();
    }

    @Override
    public MarkIndexPrices prices(String instrument) throws PriceUnavailableException {
        MarkIndexPrices current = prices.get(instrument);
        if (current == null) {
            throw new PriceUnavailableException(instrument, PriceUnavailableException.Reason.NOT_SUPPORTED,
                    "No price for " + instrument);
        }
        Instant now = clock.instant();
        if (current.updatedAt().plus(maxAge).isBefore(now)) {
            throw new PriceUnavailableException(instrument, PriceUnavailableException.Reason.STALE,
                    String.format("Price for %s is stale (updated %s, now %s)", instrument, current.updatedAt(), now));
        }
        return current;
    }

    private void store(String instrument, long markPrice, long indexPrice) {
        if (markPrice <= 0 || indexPrice <= 0) {
            throw new IllegalArgumentException("prices must be positive");
        }
        prices.put(instrument, new MarkIndexPrices(instrument, markPrice, indexPrice, clock.instant()));
    }
}
