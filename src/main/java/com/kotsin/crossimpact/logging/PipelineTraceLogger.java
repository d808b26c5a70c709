package com.kotsin.crossimpact.logging;

import com.kotsin.crossimpact.domain.model.CompositeReduction;
import com.kotsin.crossimpact.domain.model.RegressionResult;
import com.kotsin.crossimpact.domain.model.ScreenedSnapshots;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * PipelineTraceLogger - Unified logging for data flow tracing
 *
 * Shows the complete flow:
 * SNAPSHOTS → OFI → PCA → RETURNS → DESIGN/OLS → REPORT
 *
 * Format: [STAGE] symbol | key metrics | status
 */
@Slf4j
@Component
public class PipelineTraceLogger {

    /**
     * Stage 1: snapshots screened
     */
    public void logScreened(ScreenedSnapshots screened) {
        log.info("┌─[SNAPSHOTS] {} | received={} accepted={} invalid={} nonMonotonic={} shallow={}{} warnings={}",
            screened.getSymbol(), screened.getReceived(), screened.getAcceptedCount(),
            screened.getRejectedInvalid(), screened.getRejectedNonMonotonic(),
            screened.getMissingLevelSnapshots(), screened.isResorted() ? " (re-sorted)" : "",
            screened.getWarnings());
    }

    /**
     * Stage 2: level OFI computed (and gridded)
     */
    public void logLevelOfi(String symbol, int events, int gridded) {
        log.info("├─[OFI] {} | events={} gridded={}", symbol, events, gridded);
    }

    /**
     * Stage 3: composite reduction
     */
    public void logReduction(CompositeReduction reduction) {
        if (!reduction.isSuccessful()) {
            log.info("├─[PCA] {} | n={} | ✗ {}: {}", reduction.getSymbol(), reduction.getObservations(),
                reduction.getFailureKind(), reduction.getFailureReason());
            return;
        }
        log.info("├─[PCA] {} | n={} weights={} explained={} | {}",
            reduction.getSymbol(), reduction.getObservations(), formatVector(reduction.getWeights()),
            String.format("%.3f", reduction.getExplainedVariance()),
            reduction.isLowFidelity() ? "⚠ low-fidelity" : "✓");
    }

    /**
     * Stage 4: forward returns
     */
    public void logReturns(String symbol, int snapshots, int changes) {
        log.info("├─[RETURNS] {} | snapshots={} changes={}", symbol, snapshots, changes);
    }

    /**
     * Stage 5: one regression unit
     */
    public void logRegression(RegressionResult result) {
        if (!result.isOk()) {
            log.info("├─[OLS] {} | h={} {} | n={} | ✗ {}: {}", result.getTargetSymbol(), result.getHorizon(),
                result.getMode(), result.getObservations(), result.getFailureKind(), result.getFailureReason());
            return;
        }
        log.info("├─[OLS] {} | h={} {} | n={} self={} R2={} cross/self={}", result.getTargetSymbol(),
            result.getHorizon(), result.getMode(), result.getObservations(),
            String.format("%.6g", result.getSelfCoefficient()), formatNullable(result.getRSquared()),
            formatNullable(result.getCrossToSelfRatio()));
    }

    /**
     * Stage 6: batch complete
     */
    public void logBatchComplete(String runId, int symbols, int units, long failedUnits, long elapsedMs) {
        log.info("└─[REPORT] run={} | symbols={} units={} failed={} | {}ms",
            runId, symbols, units, failedUnits, elapsedMs);
    }

    private static String formatVector(double[] values) {
        if (values == null) {
            return "-";
        }
        return Arrays.stream(values)
            .mapToObj(v -> String.format("%.3f", v))
            .reduce((a, b) -> a + "," + b)
            .map(s -> "[" + s + "]")
            .orElse("[]");
    }

    private static String formatNullable(Double value) {
        return value == null ? "n/a" : String.format("%.4f", value);
    }
}
