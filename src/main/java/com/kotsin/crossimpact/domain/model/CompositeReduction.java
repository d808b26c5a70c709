package com.kotsin.crossimpact.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Outcome of reducing one symbol's level OFI history to a composite series:
 * the scores plus the fitted loading vector and its diagnostics.
 */
@Value
@Builder
public class CompositeReduction {
    String symbol;
    int observations;
    List<CompositeOFIRecord> records;
    double[] weights;
    /** Descending. */
    double[] eigenvalues;
    Double explainedVariance;
    boolean lowFidelity;

    FailureKind failureKind;
    String failureReason;

    public static CompositeReduction failed(String symbol, int observations, FailureKind kind, String reason) {
        return CompositeReduction.builder()
            .symbol(symbol)
            .observations(observations)
            .records(Collections.emptyList())
            .failureKind(kind)
            .failureReason(reason)
            .build();
    }

    public double[] getWeights() {
        return weights == null ? null : weights.clone();
    }

    public double[] getEigenvalues() {
        return eigenvalues == null ? null : eigenvalues.clone();
    }

    public boolean isSuccessful() {
        return failureKind == null;
    }

    @JsonIgnore
    public NavigableMap<Instant, Double> scoresByTimestamp() {
        NavigableMap<Instant, Double> scores = new TreeMap<>();
        for (CompositeOFIRecord record : records) {
            scores.put(record.getTimestamp(), record.getScore());
        }
        return scores;
    }
}
