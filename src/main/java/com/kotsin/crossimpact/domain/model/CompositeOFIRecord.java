package com.kotsin.crossimpact.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Composite (first principal component) OFI score of one symbol at one timestamp.
 * Weights and explained variance are diagnostics of the fit that produced the score.
 */
@Value
@Builder
public class CompositeOFIRecord {
    String symbol;
    Instant timestamp;
    double score;
    double[] weights;
    double explainedVariance;
    boolean lowFidelity;

    public double[] getWeights() {
        return weights.clone();
    }
}
