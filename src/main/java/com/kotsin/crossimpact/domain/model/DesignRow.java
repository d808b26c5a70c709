package com.kotsin.crossimpact.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * One fully populated observation of a cross-impact regression.
 *
 * {@code timestamp} is the start of the return window. The OFI values were observed
 * at {@code mode.ofiTimestamp(timestamp, horizon)}.
 */
@Value
@Builder
public class DesignRow {
    Instant timestamp;
    String targetSymbol;
    Duration horizon;
    ImpactMode mode;
    double targetReturn;
    double selfOfi;
    /** Other symbol -> composite OFI, ordered by symbol. */
    Map<String, Double> crossOfi;
}
