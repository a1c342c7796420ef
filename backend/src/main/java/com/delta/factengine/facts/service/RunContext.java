package com.delta.factengine.facts.service;

import com.delta.factengine.facts.fx.ExchangeRateTable;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State shared by every entity of one run. Built once by the coordinator.
 */
public record RunContext(
    Instant startedAt,
    boolean force,
    ExchangeRateTable exchangeRates,
    AtomicBoolean shutdownFlag
) {
    public boolean isShutdownRequested() {
        return shutdownFlag != null && shutdownFlag.get();
    }
}
