package com.flashperp.keeper;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration for the keeper process.
 */
public class KeeperConfig {
    private static final String DEFAULT_DATA_DIR = System.getProperty("user.home") + "/.flashperp";
    private static final String EXCHANGE_CONFIG_NAME = "exchange.yaml";

    private final Path dataDir;
    private final Path exchangeConfigPath;
    private final String keeperAccount;
    private final long fundingSweepSeconds;
    private final long liquidationScanSeconds;
    private final long statusIntervalMinutes;

    public KeeperConfig(Path dataDir, Path exchangeConfigPath, String keeperAccount,
                        long fundingSweepSeconds, long liquidationScanSeconds, long statusIntervalMinutes) {
        if (fundingSweepSeconds <= 0 || liquidationScanSeconds <= 0 || statusIntervalMinutes <= 0) {
            throw new IllegalArgumentException("Keeper intervals must be positive");
        }
        this.dataDir = dataDir;
        this.exchangeConfigPath = exchangeConfigPath;
        this.keeperAccount = keeperAccount;
        this.fundingSweepSeconds = fundingSweepSeconds;
        this.liquidationScanSeconds = liquidationScanSeconds;
        this.statusIntervalMinutes = statusIntervalMinutes;
    }

    public static KeeperConfig load() {
        // System properties win over environment, then defaults
        String dataDirStr = setting("flashperp.keeper.dir", "FLASHPERP_DIR", DEFAULT_DATA_DIR);
        Path dataDir = Paths.get(dataDirStr);

        Path exchangeConfig = Paths.get(setting("flashperp.keeper.exchange_config", "FLASHPERP_EXCHANGE_CONFIG",
            dataDir.resolve(EXCHANGE_CONFIG_NAME).toString()));

        String account = setting("flashperp.keeper.account", "FLASHPERP_KEEPER_ACCOUNT", "keeper");

        long fundingSweep = Long.parseLong(setting("flashperp.keeper.funding_sweep_seconds",
            "FLASHPERP_FUNDING_SWEEP_SECONDS", "60"));

        long liquidationScan = Long.parseLong(setting("flashperp.keeper.liquidation_scan_seconds",
            "FLASHPERP_LIQUIDATION_SCAN_SECONDS", "5"));

        long status = Long.parseLong(setting("flashperp.keeper.status_minutes",
            "FLASHPERP_STATUS_MINUTES", "5"));

        return new KeeperConfig(dataDir, exchangeConfig, account, fundingSweep, liquidationScan, status);
    }

    private static String setting(String property, String env, String defaultValue) {
        return System.getProperty(property, System.getenv().getOrDefault(env, defaultValue));
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getExchangeConfigPath() {
        return exchangeConfigPath;
    }

    public String getKeeperAccount() {
        return keeperAccount;
    }

    public long getFundingSweepSeconds() {
        return fundingSweepSeconds;
    }

    public long getLiquidationScanSeconds() {
        return liquidationScanSeconds;
    }

    public long getStatusIntervalMinutes() {
        return statusIntervalMinutes;
    }
}
