package com.flashperp.ledger.admin;

import com.flashperp.core.exception.PreconditionException;
import com.flashperp.core.model.ExchangeParameters;
import com.flashperp.ledger.custody.AssetNotConfiguredException;
import com.flashperp.ledger.custody.Custody;
import com.flashperp.ledger.state.InstrumentRegistry;
import com.flashperp.ledger.state.ParameterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Administrative surface: pause switch, parameter replacement and instrument onboarding.
 */
public class ExchangeAdmin {

    private static final Logger log = LoggerFactory.getLogger(ExchangeAdmin.class);

    private final ParameterStore parameters;
    private final InstrumentRegistry instruments;
    private final Custody custody;
    private final Clock clock;

    public ExchangeAdmin(ParameterStore parameters, InstrumentRegistry instruments, Custody custody, Clock clock) {
        this.parameters = parameters;
        this.instruments = instruments;
        this.custody = custody;
        this.clock = clock;
    }

    /**
     * Halt all trading, funding and liquidation operations.
     */
    public void pause() {
        parameters.setPaused(true);
        log.warn("Exchange PAUSED - all ledger operations halted");
    }

    public void unpause() {
        parameters.setPaused(false);
        log.info("Exchange unpaused - trading re-enabled");
    }

    public boolean isPaused() {
        return parameters.isPaused();
    }

    /**
     * Replace the parameter snapshot. Operations already running keep the snapshot they started with.
     */
    public void updateParameters(ExchangeParameters next) {
        ExchangeParameters previous = parameters.current();
        parameters.replace(next);
        log.info("Parameters updated: {} -> {}", previous, next);
    }

    public ExchangeParameters getParameters() {
        return parameters.current();
    }

    /**
     * Support a new instrument. Its collateral asset must already be configured in custody.
     * The funding rate starts at zero with the next update due one interval from now.
     *
     * @return false if the instrument was already supported
     */
    public boolean onboardInstrument(String instrument) throws PreconditionException {
        if (instrument == null || instrument.isBlank()) {
            throw new PreconditionException(PreconditionException.Reason.UNSUPPORTED_INSTRUMENT,
                    "Instrument id is required");
        }
        try {
            String asset = custody.collateralAssetFor(instrument);
            boolean added = instruments.add(instrument, clock.instant());
            if (added) {
                log.info("Instrument onboarded: {} (collateral {})", instrument, asset);
            }
            return added;
        } catch (AssetNotConfiguredException e) {
            throw new PreconditionException(PreconditionException.Reason.UNSUPPORTED_ASSET, e.getMessage(), e);
        }
    }

    public boolean isSupported(String instrument) {
        return instruments.isSupported(instrument);
    }

    public List<String> getSupportedInstruments() {
        return instruments.instruments();
    }
}
