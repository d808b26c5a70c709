package com.kotsin.crossimpact.domain.calculator;

import com.kotsin.crossimpact.domain.model.CrossImpactMatrix;
import com.kotsin.crossimpact.domain.model.ImpactMode;
import com.kotsin.crossimpact.domain.model.RegressionResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Collects the fitted units of one (horizon, mode) into a target x source coefficient matrix.
 */
@Component
public class CrossImpactMatrixBuilder {

    public CrossImpactMatrix build(List<String> symbols, Duration horizon, ImpactMode mode,
                                   List<RegressionResult> results) {
        int n = symbols.size();
        Double[][] coefficients = new Double[n][n];
        Double[] rSquared = new Double[n];

        for (RegressionResult result : results) {
            if (!horizon.equals(result.getHorizon()) || result.getMode() != mode || !result.isOk()) {
                continue;
            }
            int row = symbols.indexOf(result.getTargetSymbol());
            if (row < 0) {
                continue;
            }
            coefficients[row][row] = result.getSelfCoefficient();
            result.getCrossCoefficients().forEach((source, coefficient) -> {
                int col = symbols.indexOf(source);
                if (col >= 0) {
                    coefficients[row][col] = coefficient;
                }
            });
            rSquared[row] = result.getRSquared();
        }

        return CrossImpactMatrix.builder()
            .horizon(horizon)
            .mode(mode)
            .symbols(List.copyOf(symbols))
            .coefficients(coefficients)
            .rSquared(rSquared)
            .build();
    }
}
