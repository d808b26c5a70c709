package com.kotsin.crossimpact.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Batch output of one analysis run. Enumerates every requested regression unit,
 * each either fitted or marked failed.
 */
@Value
@Builder
public class CrossImpactReport {
    String runId;
    Instant generatedAt;
    Duration binWidth;
    List<Duration> horizons;
    ReturnConvention convention;
    Instant windowStart;
    Instant windowEnd;
    List<String> symbols;
    List<SymbolAnalysis> symbolAnalyses;
    List<RegressionResult> regressionResults;
    List<CrossImpactMatrix> matrices;

    public Optional<RegressionResult> result(String target, Duration horizon, ImpactMode mode) {
        return regressionResults.stream()
            .filter(r -> r.getTargetSymbol().equals(target)
                && r.getHorizon().equals(horizon)
                && r.getMode() == mode)
            .findFirst();
    }

    public Optional<SymbolAnalysis> symbol(String symbol) {
        return symbolAnalyses.stream()
            .filter(s -> s.getSymbol().equals(symbol))
            .findFirst();
    }

    public long getFailedUnits() {
        return regressionResults.stream().filter(r -> !r.isOk()).count();
    }
}
