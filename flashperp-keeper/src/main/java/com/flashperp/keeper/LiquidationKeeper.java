package com.flashperp.keeper;

import com.flashperp.core.exception.LedgerException;
import com.flashperp.core.exception.PreconditionException;
import com.flashperp.core.model.LiquidationResult;
import com.flashperp.core.model.Position;
import com.flashperp.ledger.PerpExchange;
import com.flashperp.ledger.liquidation.LiquidationEvaluator;
import com.flashperp.ledger.price.PriceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Scans open positions and liquidates the under-margined ones.
 * Outstanding funding is settled on each position before it is checked.
 * Each instrument is checked and liquidated against one pinned price snapshot.
 */
public class LiquidationKeeper {
    private static final Logger LOG = LoggerFactory.getLogger(LiquidationKeeper.class);

    private final PerpExchange exchange;
    private final String keeperAccount;

    public LiquidationKeeper(PerpExchange exchange, String keeperAccount) {
        this.exchange = exchange;
        this.keeperAccount = keeperAccount;
    }

    /**
     * Run one pass over all supported instruments.
     *
     * @return the liquidations performed
     */
    public List<LiquidationResult> scan() {
        List<LiquidationResult> results = new ArrayList<>();
        if (exchange.getAdmin().isPaused()) {
            LOG.debug("Exchange paused, skipping liquidation scan");
            return results;
        }
        LiquidationEvaluator evaluator = exchange.getLiquidationEvaluator();

        for (String instrument : exchange.getAdmin().getSupportedInstruments()) {
            List<Position> open = exchange.getLedger().getOpenPositions(instrument);
            if (open.isEmpty()) {
                continue;
            }
            PriceSnapshot snapshot;
            try {
                snapshot = evaluator.snapshot(instrument);
            } catch (PreconditionException e) {
                LOG.warn("Skipping liquidation scan for {}: {}", instrument, e.getMessage());
                continue;
            }

            for (Position position : open) {
                settleFunding(position.getId());
                if (!evaluator.isLiquidatable(position.getId(), snapshot)) {
                    continue;
                }
                try {
                    results.add(exchange.getLedger().liquidate(position.getId(), keeperAccount, snapshot));
                } catch (LedgerException e) {
                    // another caller may have closed or topped up the position in between
                    LOG.info("Liquidation of #{} skipped: {}", position.getId(), e.getMessage());
                }
            }
        }
        if (!results.isEmpty()) {
            LOG.info("Liquidation scan liquidated {} positions", results.size());
        }
        return results;
    }

    // the margin check reads committed collateral, so owed funding has to land first
    private void settleFunding(long positionId) {
        try {
            exchange.getLedger().applyFunding(positionId);
        } catch (LedgerException e) {
            LOG.info("Funding settlement of #{} skipped: {}", positionId, e.getMessage());
        }
    }
}
