package com.flashperp.ledger.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.flashperp.core.model.ExchangeParameters;
import com.flashperp.core.model.FundingSettlementPolicy;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Exchange configuration file (YAML). Missing file means defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExchangeConfig {

    private String treasury = "treasury";
    private ParametersConfig parameters = new ParametersConfig();
    private List<String> collateralAssets = new ArrayList<>();
    private List<InstrumentConfig> instruments = new ArrayList<>();

    public String getTreasury() { return treasury; }
    public void setTreasury(String treasury) { this.treasury = treasury; }

    public ParametersConfig getParameters() { return parameters; }
    public void setParameters(ParametersConfig parameters) { this.parameters = parameters; }

    public List<String> getCollateralAssets() { return collateralAssets; }
    public void setCollateralAssets(List<String> collateralAssets) { this.collateralAssets = collateralAssets; }

    public List<InstrumentConfig> getInstruments() { return instruments; }
    public void setInstruments(List<InstrumentConfig> instruments) { this.instruments = instruments; }

    public static ExchangeConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new ExchangeConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(path.toFile(), ExchangeConfig.class);
    }

    public void save(Path path) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writeValue(path.toFile(), this);
    }

    public static Path defaultPath() {
        return Path.of(System.getProperty("user.home"), ".flashperp", "exchange.yaml");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ParametersConfig {
        private long fundingIntervalMinutes = 480;
        private long fundingRateFactor = 1000;
        private long maintenanceMarginBps = 200;
        private long liquidationFeeBps = 50;
        private long takerFeeBps = 5;
        private long makerFeeBps = 2;
        private int maxLeverage = 50;
        private boolean onePositionPerInstrument;
        private FundingSettlementPolicy fundingSettlementPolicy = FundingSettlementPolicy.CLAMP_AT_ZERO;
        private long maxPriceAgeSeconds = 300;

        public long getFundingIntervalMinutes() { return fundingIntervalMinutes; }
        public void setFundingIntervalMinutes(long v) { this.fundingIntervalMinutes = v; }

        public long getFundingRateFactor() { return fundingRateFactor; }
        public void setFundingRateFactor(long v) { this.fundingRateFactor = v; }

        public long getMaintenanceMarginBps() { return maintenanceMarginBps; }
        public void setMaintenanceMarginBps(long v) { this.maintenanceMarginBps = v; }

        public long getLiquidationFeeBps() { return liquidationFeeBps; }
        public void setLiquidationFeeBps(long v) { this.liquidationFeeBps = v; }

        public long getTakerFeeBps() { return takerFeeBps; }
        public void setTakerFeeBps(long v) { this.takerFeeBps = v; }

        public long getMakerFeeBps() { return makerFeeBps; }
        public void setMakerFeeBps(long v) { this.makerFeeBps = v; }

        public int getMaxLeverage() { return maxLeverage; }
        public void setMaxLeverage(int v) { this.maxLeverage = v; }

        public boolean isOnePositionPerInstrument() { return onePositionPerInstrument; }
        public void setOnePositionPerInstrument(boolean v) { this.onePositionPerInstrument = v; }

        public FundingSettlementPolicy getFundingSettlementPolicy() { return fundingSettlementPolicy; }
        public void setFundingSettlementPolicy(FundingSettlementPolicy v) { this.fundingSettlementPolicy = v; }

        public long getMaxPriceAgeSeconds() { return maxPriceAgeSeconds; }
        public void setMaxPriceAgeSeconds(long v) { this.maxPriceAgeSeconds = v; }

        public ExchangeParameters toParameters() {
            return ExchangeParameters.builder()
                    .fundingInterval(Duration.ofMinutes(fundingIntervalMinutes))
                    .fundingRateFactor(fundingRateFactor)
                    .maintenanceMarginBps(maintenanceMarginBps)
                    .liquidationFeeBps(liquidationFeeBps)
                    .takerFeeBps(takerFeeBps)
                    .makerFeeBps(makerFeeBps)
                    .maxLeverage(maxLeverage)
                    .onePositionPerInstrument(onePositionPerInstrument)
                    .fundingSettlementPolicy(fundingSettlementPolicy)
                    .maxPriceAge(Duration.ofSeconds(maxPriceAgeSeconds))
                    .build();
        }
    }

    /**
     * An instrument to onboard at startup, with the prices to seed the feed with.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InstrumentConfig {
        private String id;
        private String collateralAsset;
        private BigDecimal markPrice;
        private BigDecimal indexPrice;

        public InstrumentConfig() {}

        public InstrumentConfig(String id, String collateralAsset, BigDecimal markPrice, BigDecimal indexPrice) {
            this.id = id;
            this.collateralAsset = collateralAsset;
            this.markPrice = markPrice;
            this.indexPrice = indexPrice;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getCollateralAsset() { return collateralAsset; }
        public void setCollateralAsset(String collateralAsset) { this.collateralAsset = collateralAsset; }

        public BigDecimal getMarkPrice() { return markPrice; }
        public void setMarkPrice(BigDecimal markPrice) { this.markPrice = markPrice; }

        public BigDecimal getIndexPrice() { return indexPrice; }
        public void setIndexPrice(BigDecimal indexPrice) { this.indexPrice = indexPrice; }
    }
}
