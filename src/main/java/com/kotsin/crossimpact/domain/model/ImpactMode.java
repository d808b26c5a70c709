package com.kotsin.crossimpact.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * ImpactMode - Which OFI observation is paired with a return over [t, t+h].
 */
public enum ImpactMode {
    /**
     * OFI at t explains the return over [t, t+h]
     */
    CONTEMPORANEOUS,

    /**
     * OFI at t-h predicts the return over [t, t+h]
     */
    LAGGED;

    public Instant ofiTimestamp(Instant returnStart, Duration horizon) {
        return this == LAGGED ? returnStart.minus(horizon) : returnStart;
    }
}
