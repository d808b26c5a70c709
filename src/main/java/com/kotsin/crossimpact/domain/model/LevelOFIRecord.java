package com.kotsin.crossimpact.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Per-level order flow imbalance of one symbol at one timestamp.
 *
 * Defined only relative to the preceding snapshot (or, once gridded, as the sum of
 * such increments inside one grid bin).
 */
@Value
@Builder
public class LevelOFIRecord {
    String symbol;
    Instant timestamp;
    double[] levelOfi;
    /** Levels that were absent in either snapshot and therefore contributed 0. */
    int missingLevels;

    public double[] getLevelOfi() {
        return levelOfi.clone();
    }

    /**
     * @param n 1-based level rank
     */
    public double level(int n) {
        return levelOfi[n - 1];
    }

    public int depth() {
        return levelOfi.length;
    }
}
