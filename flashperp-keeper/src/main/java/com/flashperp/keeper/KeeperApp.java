package com.flashperp.keeper;

import com.flashperp.core.exception.PreconditionException;
import com.flashperp.core.model.LiquidationResult;
import com.flashperp.ledger.PerpExchange;
import com.flashperp.ledger.config.ExchangeConfig;
import com.flashperp.ledger.journal.ShortfallEvent;
import org.apache.logging.log4j.LogManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * FlashPerp Keeper - standalone daemon that runs the exchange and keeps it current.
 * Sweeps funding rates when due and liquidates under-margined positions on a fixed schedule.
 */
public class KeeperApp {
    private static final Logger LOG = LoggerFactory.getLogger(KeeperApp.class);

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private static ScheduledExecutorService scheduler;
    private static PerpExchange exchange;
    private static Instant startTime;

    public static void main(String[] args) {
        LOG.info("Starting FlashPerp Keeper...");
        startTime = Instant.now();

        try {
            KeeperConfig config = KeeperConfig.load();

            ExchangeConfig exchangeConfig = ExchangeConfig.load(config.getExchangeConfigPath());
            LOG.info("Exchange config loaded from {}", config.getExchangeConfigPath());

            ExchangeBootstrap bootstrap = ExchangeBootstrap.create(exchangeConfig, config.getDataDir(),
                Clock.systemUTC());
            exchange = bootstrap.getExchange();

            LiquidationKeeper liquidationKeeper = new LiquidationKeeper(exchange, config.getKeeperAccount());
            schedule(config, liquidationKeeper);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("Shutting down FlashPerp Keeper...");
                cleanup();
                LogManager.shutdown();
            }));

            LOG.info("FlashPerp Keeper started (data dir {})", config.getDataDir());
            shutdownLatch.await();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Keeper interrupted");
        } catch (Exception e) {
            LOG.error("Failed to start Keeper", e);
            System.exit(1);
        }
    }

    private static void cleanup() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (exchange != null) {
            exchange.close();
        }
        shutdownLatch.countDown();
    }

    private static void schedule(KeeperConfig config, LiquidationKeeper liquidationKeeper) {
        scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "keeper-scheduler");
            t.setDaemon(true);
            return t;
        });

        // Funding sweep: no-op for instruments that are not due yet
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                exchange.getFundingEngine().updateFundingRates();
            } catch (PreconditionException e) {
                LOG.debug("Funding sweep skipped: {}", e.getMessage());
            } catch (Exception e) {
                LOG.error("Funding sweep failed", e);
            }
        }, 0, config.getFundingSweepSeconds(), TimeUnit.SECONDS);

        scheduler.scheduleWithFixedDelay(() -> {
            try {
                List<LiquidationResult> liquidated = liquidationKeeper.scan();
                for (LiquidationResult result : liquidated) {
                    LOG.info("Liquidated #{} @ {} fee={} shortfall={}",
                        result.positionId(), result.price(), result.fee(), result.shortfall());
                }
            } catch (Exception e) {
                LOG.error("Liquidation scan failed", e);
            }
        }, config.getLiquidationScanSeconds(), config.getLiquidationScanSeconds(), TimeUnit.SECONDS);

        scheduler.scheduleAtFixedRate(() -> {
            try {
                long uptimeMin = Duration.between(startTime, Instant.now()).toMinutes();
                // journal totals include shortfalls from before a restart
                LocalDate today = LocalDate.now(ZoneOffset.UTC);
                long shortfallToday = exchange.getJournal().shortfalls(today, today).stream()
                    .mapToLong(ShortfallEvent::getAmount)
                    .sum();
                LOG.info("STATUS | uptime={}m | instruments={} | openPositions={} | shortfallToday={} | paused={}",
                    uptimeMin,
                    exchange.getAdmin().getSupportedInstruments().size(),
                    exchange.getLedger().getOpenPositions().size(),
                    shortfallToday,
                    exchange.getAdmin().isPaused());
            } catch (Exception e) {
                LOG.debug("Status heartbeat error: {}", e.getMessage());
            }
        }, 1, config.getStatusIntervalMinutes(), TimeUnit.MINUTES);

        LOG.info("Scheduled funding sweep every {}s, liquidation scan every {}s",
            config.getFundingSweepSeconds(), config.getLiquidationScanSeconds());
    }
}
