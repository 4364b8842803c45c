package com.flashperp.ledger.state;

import com.flashperp.core.model.ExchangeParameters;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Current parameter snapshot and the pause flag.
 */
public class ParameterStore {

    private final AtomicReference<ExchangeParameters> parameters;
    private volatile boolean paused;

    public ParameterStore(ExchangeParameters initial) {
        this.parameters = new AtomicReference<>(initial);
    }

    public ExchangeParameters current() {
        return parameters.get();
    }

    public void replace(ExchangeParameters next) {
        parameters.set(next);
    }

    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }
}
