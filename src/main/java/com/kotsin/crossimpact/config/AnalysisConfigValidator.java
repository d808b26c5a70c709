package com.kotsin.crossimpact.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fails fast on configuration the pipeline cannot run with.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnalysisConfigValidator {

    private final AnalysisConfig config;

    @PostConstruct
    public void validateConfiguration() {
        log.info("[CONFIG] Validating analysis configuration...");

        List<String> errors = validate(config);

        if (!errors.isEmpty()) {
            log.error("[CONFIG] Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", errors));
        }

        log.info("[CONFIG] binWidth={} horizons={} convention={} aggregateOfi={} minObs={} lowFidelity<{} poolSize={}",
            config.getGrid().getBinWidth(), config.getHorizons(), config.getReturns().getConvention(),
            config.getGrid().isAggregateOfi(), config.getReduction().getMinObservations(),
            config.getReduction().getLowFidelityThreshold(), config.getExecutor().getPoolSize());
    }

    public static List<String> validate(AnalysisConfig config) {
        List<String> errors = new ArrayList<>();

        Duration binWidth = config.getGrid().getBinWidth();
        if (binWidth == null || binWidth.isZero() || binWidth.isNegative()) {
            errors.add("analysis.grid.bin-width must be positive");
        }

        if (config.getHorizons() == null || config.getHorizons().isEmpty()) {
            errors.add("analysis.horizons must list at least one horizon");
        } else {
            Set<Duration> seen = new HashSet<>();
            for (Duration horizon : config.getHorizons()) {
                if (horizon == null || horizon.isZero() || horizon.isNegative()) {
                    errors.add("analysis.horizons contains a non-positive horizon: " + horizon);
                } else if (binWidth != null && !binWidth.isZero() && !binWidth.isNegative()
                    && horizon.toNanos() % binWidth.toNanos() != 0) {
                    errors.add("horizon " + horizon + " is not a multiple of bin width " + binWidth);
                }
                if (horizon != null && !seen.add(horizon)) {
                    errors.add("analysis.horizons lists " + horizon + " twice");
                }
            }
        }

        if (config.getReturns().getConvention() == null) {
            errors.add("analysis.returns.convention is not configured");
        }

        AnalysisConfig.Reduction reduction = config.getReduction();
        if (reduction.getMinObservations() < 2) {
            errors.add("analysis.reduction.min-observations must be at least 2");
        }
        if (reduction.getLowFidelityThreshold() < 0.0 || reduction.getLowFidelityThreshold() > 1.0) {
            errors.add("analysis.reduction.low-fidelity-threshold must be within [0, 1]");
        }

        AnalysisConfig.Regression regression = config.getRegression();
        if (regression.getMinResidualDof() < 0) {
            errors.add("analysis.regression.min-residual-dof must not be negative");
        }
        if (regression.getSingularityTolerance() <= 0.0) {
            errors.add("analysis.regression.singularity-tolerance must be positive");
        }

        if (config.getExecutor().getPoolSize() < 1) {
            errors.add("analysis.executor.pool-size must be at least 1");
        }

        AnalysisConfig.Runner runner = config.getRunner();
        if (runner.isEnabled() && (runner.getSymbols() == null || runner.getSymbols().isEmpty())) {
            errors.add("analysis.runner.symbols is empty while the runner is enabled");
        }

        return errors;
    }
}
