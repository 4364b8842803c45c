package com.flashperp.ledger;

import com.flashperp.core.model.ExchangeParameters;
import com.flashperp.ledger.admin.ExchangeAdmin;
import com.flashperp.ledger.custody.Custody;
import com.flashperp.ledger.funding.FundingEngine;
import com.flashperp.ledger.journal.LedgerJournal;
import com.flashperp.ledger.liquidation.LiquidationEvaluator;
import com.flashperp.ledger.price.PriceFeed;
import com.flashperp.ledger.state.AgentRegistry;
import com.flashperp.ledger.state.InstrumentRegistry;
import com.flashperp.ledger.state.ParameterStore;
import com.flashperp.ledger.state.PositionStore;
import com.flashperp.ledger.state.ShortfallLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Wires the ledger components around one custody capability and one price feed.
 */
public class PerpExchange {

    private static final Logger log = LoggerFactory.getLogger(PerpExchange.class);

    private final PositionLedger ledger;
    private final FundingEngine fundingEngine;
    private final LiquidationEvaluator liquidationEvaluator;
    private final ExchangeAdmin admin;
    private final LedgerJournal journal;

    public PerpExchange(Custody custody, PriceFeed priceFeed, LedgerJournal journal, Clock clock,
                        ExchangeParameters parameters, String treasury) {
        if (treasury == null || treasury.isBlank()) {
            throw new IllegalArgumentException("treasury account is required");
        }
        ParameterStore parameterStore = new ParameterStore(parameters);
        InstrumentRegistry instruments = new InstrumentRegistry();
        PositionStore positions = new PositionStore();

        this.journal = journal;
        this.fundingEngine = new FundingEngine(instruments, priceFeed, parameterStore, journal, clock);
        this.liquidationEvaluator = new LiquidationEvaluator(positions, priceFeed, parameterStore, clock);
        this.admin = new ExchangeAdmin(parameterStore, instruments, custody, clock);
        this.ledger = new PositionLedger(positions, instruments, parameterStore, new AgentRegistry(),
                new ShortfallLedger(), fundingEngine, liquidationEvaluator, custody, priceFeed, journal, clock,
                treasury);

        log.info("Exchange ready (treasury={}, maxLeverage={}x, fundingInterval={})",
                treasury, parameters.maxLeverage(), parameters.fundingInterval());
    }

    public PositionLedger getLedger() {
        return ledger;
    }

    public FundingEngine getFundingEngine() {
        return fundingEngine;
    }

    public LiquidationEvaluator getLiquidationEvaluator() {
        return liquidationEvaluator;
    }

    public ExchangeAdmin getAdmin() {
        return admin;
    }

    public LedgerJournal getJournal() {
        return journal;
    }

    public void close() {
        journal.close();
    }
}
