package com.kotsin.crossimpact.domain.calculator;

import com.kotsin.crossimpact.config.AnalysisConfig;
import com.kotsin.crossimpact.domain.model.DesignRow;
import com.kotsin.crossimpact.domain.model.FailureKind;
import com.kotsin.crossimpact.domain.model.FitStatus;
import com.kotsin.crossimpact.domain.model.ImpactMode;
import com.kotsin.crossimpact.domain.model.RegressionResult;
import com.kotsin.crossimpact.util.LinearAlgebra;
import com.kotsin.crossimpact.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RegressionEngine - OLS fit of one (target, horizon, mode) cross-impact unit.
 *
 *   return(target) = a + b_self * OFI(target) + sum_j b_j * OFI(j) + e
 *
 * Solved by Householder QR. Rank-deficient designs and designs with too few rows come
 * back as FAILED results, never as exceptions, so one bad unit cannot stop the batch.
 *
 * Dominance diagnostic: mean(|b_j|) / |b_self|, the same formula for both modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RegressionEngine {

    private final AnalysisConfig config;

    public RegressionResult fit(String targetSymbol, Duration horizon, ImpactMode mode,
                                List<String> crossSymbols, List<DesignRow> rows) {
        int regressors = 2 + crossSymbols.size();
        int n = rows.size();
        int required = regressors + config.getRegression().getMinResidualDof();

        if (n < required) {
            log.warn("[OLS] {} h={} {} has {} rows, need {} for {} regressors",
                targetSymbol, horizon, mode, n, required, regressors);
            return RegressionResult.failed(targetSymbol, horizon, mode, FailureKind.INSUFFICIENT_HISTORY,
                String.format("%d aligned rows, at least %d required for %d regressors", n, required, regressors), n);
        }

        double[][] x = new double[n][regressors];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            DesignRow row = rows.get(i);
            if (!row.getCrossOfi().keySet().containsAll(crossSymbols) || row.getCrossOfi().size() != crossSymbols.size()) {
                throw new IllegalArgumentException("Row at " + row.getTimestamp() + " does not carry cross symbols " + crossSymbols);
            }
            x[i][0] = 1.0;
            x[i][1] = row.getSelfOfi();
            for (int j = 0; j < crossSymbols.size(); j++) {
                x[i][2 + j] = row.getCrossOfi().get(crossSymbols.get(j));
            }
            y[i] = row.getTargetReturn();
        }

        LinearAlgebra.LeastSquaresSolution solution =
            LinearAlgebra.solveLeastSquares(x, y, config.getRegression().getSingularityTolerance());
        if (!solution.isFullRank()) {
            String column = columnName(solution.getDeficientColumn(), crossSymbols);
            log.warn("[OLS] {} h={} {} design is rank deficient at column {}", targetSymbol, horizon, mode, column);
            return RegressionResult.failed(targetSymbol, horizon, mode, FailureKind.SINGULAR_DESIGN_MATRIX,
                "regressor '" + column + "' is collinear with the preceding columns", n);
        }

        double[] beta = solution.getCoefficients();
        Double rSquared = rSquared(x, y, beta);
        Double adjusted = adjustedRSquared(rSquared, n, regressors);

        Map<String, Double> cross = new LinkedHashMap<>();
        for (int j = 0; j < crossSymbols.size(); j++) {
            cross.put(crossSymbols.get(j), beta[2 + j]);
        }

        RegressionResult result = RegressionResult.builder()
            .targetSymbol(targetSymbol)
            .horizon(horizon)
            .mode(mode)
            .status(FitStatus.OK)
            .observations(n)
            .intercept(beta[0])
            .selfCoefficient(beta[1])
            .crossCoefficients(Collections.unmodifiableMap(cross))
            .rSquared(rSquared)
            .adjustedRSquared(adjusted)
            .crossToSelfRatio(crossToSelfRatio(beta[1], cross.values()))
            .build();

        log.debug("[OLS] {} h={} {} n={} self={} R2={}", targetSymbol, horizon, mode, n,
            String.format("%.6f", beta[1]), rSquared);
        return result;
    }

    /**
     * 1 - SSres / SStot; null when the response has no variance
     */
    static Double rSquared(double[][] x, double[] y, double[] beta) {
        double mean = MathUtils.mean(y);
        double ssTot = 0.0;
        double ssRes = 0.0;
        double scale = 0.0;
        for (int i = 0; i < y.length; i++) {
            scale += y[i] * y[i];
            double fitted = LinearAlgebra.dot(x[i], beta);
            double residual = y[i] - fitted;
            ssRes += residual * residual;
            double d = y[i] - mean;
            ssTot += d * d;
        }
        // Constant response up to rounding
        if (ssTot <= 1e-20 * scale) {
            return null;
        }
        return MathUtils.definedOrNull(1.0 - ssRes / ssTot);
    }

    static Double adjustedRSquared(Double rSquared, int n, int regressors) {
        if (rSquared == null || n - regressors <= 0) {
            return null;
        }
        return 1.0 - (1.0 - rSquared) * (n - 1) / (double) (n - regressors);
    }

    /**
     * Mean absolute cross coefficient over absolute self coefficient; null when there are
     * no cross terms or the self coefficient is zero
     */
    public static Double crossToSelfRatio(double selfCoefficient, Collection<Double> crossCoefficients) {
        if (crossCoefficients.isEmpty() || selfCoefficient == 0.0) {
            return null;
        }
        double sum = 0.0;
        for (Double c : crossCoefficients) {
            sum += Math.abs(c);
        }
        return MathUtils.definedOrNull(sum / crossCoefficients.size() / Math.abs(selfCoefficient));
    }

    private static String columnName(int column, List<String> crossSymbols) {
        if (column == 0) {
            return "intercept";
        }
        if (column == 1) {
            return "self";
        }
        return crossSymbols.get(column - 2);
    }
}
