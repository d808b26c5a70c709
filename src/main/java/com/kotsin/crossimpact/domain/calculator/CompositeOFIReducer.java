package com.kotsin.crossimpact.domain.calculator;

import com.kotsin.crossimpact.config.AnalysisConfig;
import com.kotsin.crossimpact.domain.model.CompositeOFIRecord;
import com.kotsin.crossimpact.domain.model.CompositeReduction;
import com.kotsin.crossimpact.domain.model.FailureKind;
import com.kotsin.crossimpact.domain.model.LevelOFIRecord;
import com.kotsin.crossimpact.util.LinearAlgebra;
import com.kotsin.crossimpact.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * CompositeOFIReducer - Projects one symbol's multi-level OFI history onto its first
 * principal component.
 *
 * Steps (fit independently per symbol, no pooling):
 * 1. Standardize each level series (population std). Zero-variance levels become all-zero.
 * 2. Covariance of the standardized series and its eigen-decomposition.
 * 3. Loading = eigenvector of the largest eigenvalue, sign fixed so the composite
 *    correlates non-negatively with raw level-1 OFI (largest loading positive when
 *    level 1 carries no variance).
 * 4. Score(t) = standardized levels(t) · loading.
 *
 * Explained variance below the configured threshold still produces scores, flagged low-fidelity.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CompositeOFIReducer {

    private final AnalysisConfig config;

    public CompositeReduction reduce(String symbol, List<LevelOFIRecord> series) {
        AnalysisConfig.Reduction settings = config.getReduction();
        int n = series.size();

        if (n < settings.getMinObservations()) {
            log.warn("[PCA] {} has {} level OFI observations, need {}", symbol, n, settings.getMinObservations());
            return CompositeReduction.failed(symbol, n, FailureKind.INSUFFICIENT_HISTORY,
                String.format("%d observations, at least %d required", n, settings.getMinObservations()));
        }

        int levels = series.get(0).depth();
        double[][] raw = new double[levels][n];
        for (int t = 0; t < n; t++) {
            LevelOFIRecord record = series.get(t);
            if (!symbol.equals(record.getSymbol()) || record.depth() != levels) {
                throw new IllegalArgumentException("Record " + record.getSymbol() + "@" + record.getTimestamp()
                    + " does not belong to the " + levels + "-level series of " + symbol);
            }
            for (int k = 0; k < levels; k++) {
                raw[k][t] = record.level(k + 1);
            }
        }

        double[][] standardized = standardize(raw, settings.getZeroVarianceEpsilon());
        double[][] covariance = covariance(standardized);
        LinearAlgebra.EigenDecomposition eigen = LinearAlgebra.symmetricEigen(covariance);

        double total = eigen.trace();
        if (total <= settings.getZeroVarianceEpsilon()) {
            log.warn("[PCA] {} every OFI level has zero variance over {} observations", symbol, n);
            return CompositeReduction.failed(symbol, n, FailureKind.INSUFFICIENT_HISTORY,
                "every OFI level has zero variance");
        }

        double[] loading = eigen.principalVector();
        double[] scores = project(standardized, loading);
        if (shouldFlip(raw[0], scores, loading)) {
            for (int k = 0; k < levels; k++) {
                loading[k] = -loading[k];
            }
            for (int t = 0; t < n; t++) {
                scores[t] = -scores[t];
            }
        }

        double explained = Math.max(0.0, eigen.getEigenvalues()[0]) / total;
        boolean lowFidelity = explained < settings.getLowFidelityThreshold();
        if (lowFidelity) {
            log.warn("[PCA] {} first component explains only {} of OFI variance (threshold {})",
                symbol, String.format("%.3f", explained), settings.getLowFidelityThreshold());
        }

        List<CompositeOFIRecord> records = new ArrayList<>(n);
        for (int t = 0; t < n; t++) {
            records.add(CompositeOFIRecord.builder()
                .symbol(symbol)
                .timestamp(series.get(t).getTimestamp())
                .score(scores[t])
                .weights(loading.clone())
                .explainedVariance(explained)
                .lowFidelity(lowFidelity)
                .build());
        }

        log.debug("[PCA] {} n={} weights={} explained={}", symbol, n, Arrays.toString(loading),
            String.format("%.4f", explained));

        return CompositeReduction.builder()
            .symbol(symbol)
            .observations(n)
            .records(List.copyOf(records))
            .weights(loading.clone())
            .eigenvalues(eigen.getEigenvalues().clone())
            .explainedVariance(explained)
            .lowFidelity(lowFidelity)
            .build();
    }

    /**
     * (x - mean) / std per row; rows with std below epsilon become all-zero
     */
    static double[][] standardize(double[][] raw, double epsilon) {
        double[][] z = new double[raw.length][];
        for (int k = 0; k < raw.length; k++) {
            double mean = MathUtils.mean(raw[k]);
            double std = MathUtils.populationStdDev(raw[k], mean);
            z[k] = new double[raw[k].length];
            if (std < epsilon) {
                continue;
            }
            for (int t = 0; t < raw[k].length; t++) {
                z[k][t] = (raw[k][t] - mean) / std;
            }
        }
        return z;
    }

    /**
     * Covariance (denominator n) between the rows of already-centred series
     */
    static double[][] covariance(double[][] centred) {
        int levels = centred.length;
        int n = centred[0].length;
        double[][] cov = new double[levels][levels];
        for (int i = 0; i < levels; i++) {
            for (int j = i; j < levels; j++) {
                double sum = 0.0;
                for (int t = 0; t < n; t++) {
                    sum += centred[i][t] * centred[j][t];
                }
                cov[i][j] = sum / n;
                cov[j][i] = cov[i][j];
            }
        }
        return cov;
    }

    private static double[] project(double[][] standardized, double[] loading) {
        int n = standardized[0].length;
        double[] scores = new double[n];
        double[] column = new double[standardized.length];
        for (int t = 0; t < n; t++) {
            for (int k = 0; k < standardized.length; k++) {
                column[k] = standardized[k][t];
            }
            scores[t] = LinearAlgebra.dot(column, loading);
        }
        return scores;
    }

    private static boolean shouldFlip(double[] levelOne, double[] scores, double[] loading) {
        double corr = MathUtils.correlation(levelOne, scores);
        if (!MathUtils.isZero(corr)) {
            return corr < 0;
        }
        int largest = 0;
        for (int k = 1; k < loading.length; k++) {
            if (Math.abs(loading[k]) > Math.abs(loading[largest])) {
                largest = k;
            }
        }
        return loading[largest] < 0;
    }
}
