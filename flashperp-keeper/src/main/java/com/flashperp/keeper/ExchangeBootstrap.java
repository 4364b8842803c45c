package com.flashperp.keeper;

import com.flashperp.core.exception.PreconditionException;
import com.flashperp.core.math.FixedPointMath;
import com.flashperp.core.model.ExchangeParameters;
import com.flashperp.ledger.PerpExchange;
import com.flashperp.ledger.config.ExchangeConfig;
import com.flashperp.ledger.custody.InMemoryCustody;
import com.flashperp.ledger.custody.UnsupportedAssetException;
import com.flashperp.ledger.journal.LedgerJournal;
import com.flashperp.ledger.price.InMemoryPriceFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builds a running exchange from an {@link ExchangeConfig}: custody assets, seeded prices and onboarded instruments.
 */
public class ExchangeBootstrap {
    private static final Logger LOG = LoggerFactory.getLogger(ExchangeBootstrap.class);

    private final InMemoryCustody custody;
    private final InMemoryPriceFeed priceFeed;
    private final PerpExchange exchange;

    private ExchangeBootstrap(InMemoryCustody custody, InMemoryPriceFeed priceFeed, PerpExchange exchange) {
        this.custody = custody;
        this.priceFeed = priceFeed;
        this.exchange = exchange;
    }

    public static ExchangeBootstrap create(ExchangeConfig config, Path dataDir, Clock clock)
            throws UnsupportedAssetException, PreconditionException {
        ExchangeParameters parameters = config.getParameters().toParameters();

        InMemoryCustody custody = new InMemoryCustody();
        for (String asset : config.getCollateralAssets()) {
            custody.addSupportedAsset(asset);
        }
        InMemoryPriceFeed priceFeed = new InMemoryPriceFeed(clock, parameters.maxPriceAge());

        for (ExchangeConfig.InstrumentConfig instrument : config.getInstruments()) {
            custody.setCollateralAsset(instrument.getId(), instrument.getCollateralAsset());
            long mark = FixedPointMath.fromDecimal(instrument.getMarkPrice());
            long index = instrument.getIndexPrice() != null
                ? FixedPointMath.fromDecimal(instrument.getIndexPrice())
                : mark;
            priceFeed.addAssetPair(instrument.getId(), mark, index);
        }

        LedgerJournal journal = new LedgerJournal(dataDir, clock);
        PerpExchange exchange = new PerpExchange(custody.issueExchangeAccess(), priceFeed, journal, clock,
            parameters, config.getTreasury());

        for (ExchangeConfig.InstrumentConfig instrument : config.getInstruments()) {
            exchange.getAdmin().onboardInstrument(instrument.getId());
        }
        LOG.info("Bootstrapped exchange with {} instruments: {}",
            config.getInstruments().size(), exchange.getAdmin().getSupportedInstruments());

        return new ExchangeBootstrap(custody, priceFeed, exchange);
    }

    public InMemoryCustody getCustody() {
        return custody;
    }

    public InMemoryPriceFeed getPriceFeed() {
        return priceFeed;
    }

    public PerpExchange getExchange() {
        return exchange;
    }
}
