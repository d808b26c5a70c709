package com.kotsin.crossimpact.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Target x source coefficient matrix for one (horizon, mode).
 *
 * Row = target, column = source, both in {@code symbols} order. The diagonal holds
 * self coefficients; null entries belong to failed units.
 */
@Value
@Builder
public class CrossImpactMatrix {
    Duration horizon;
    ImpactMode mode;
    List<String> symbols;
    Double[][] coefficients;
    @JsonProperty("rSquared")
    Double[] rSquared;

    public Double[][] getCoefficients() {
        Double[][] copy = new Double[coefficients.length][];
        for (int i = 0; i < coefficients.length; i++) {
            copy[i] = coefficients[i].clone();
        }
        return copy;
    }

    @JsonProperty("rSquared")
    public Double[] getRSquared() {
        return rSquared.clone();
    }

    public Double coefficient(String target, String source) {
        int row = symbols.indexOf(target);
        int col = symbols.indexOf(source);
        if (row < 0 || col < 0) {
            return null;
        }
        return coefficients[row][col];
    }
}
