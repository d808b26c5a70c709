package com.kotsin.crossimpact.runner;

import com.kotsin.crossimpact.config.AnalysisConfig;
import com.kotsin.crossimpact.data.AnalysisReportWriter;
import com.kotsin.crossimpact.data.BookSnapshotSource;
import com.kotsin.crossimpact.domain.model.CrossImpactReport;
import com.kotsin.crossimpact.domain.model.RegressionResult;
import com.kotsin.crossimpact.service.CrossImpactAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Batch runner: loads the configured symbols, runs one analysis and writes the JSON report.
 * Runs inside the Spring Boot app when analysis.runner.enabled=true.
 */
@Component
@ConditionalOnProperty(value = "analysis.runner.enabled", havingValue = "true", matchIfMissing = false)
@RequiredArgsConstructor
@Slf4j
public class AnalysisRunner implements CommandLineRunner {

    private final AnalysisConfig config;
    private final BookSnapshotSource snapshotSource;
    private final CrossImpactAnalysisService analysisService;
    private final AnalysisReportWriter reportWriter;

    @Override
    public void run(String... args) {
        AnalysisConfig.Runner runner = config.getRunner();
        log.info("[RUNNER] Cross-impact run: symbols={} input={} output={}",
            runner.getSymbols(), runner.getInputDir(), runner.getOutputFile());

        CrossImpactReport report = analysisService.analyze(snapshotSource, runner.getSymbols());
        logSummary(report);

        Path output = Path.of(runner.getOutputFile());
        try {
            reportWriter.write(report, output);
            log.info("[RUNNER] Report written to {}", output.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report to " + output, e);
        }
    }

    private void logSummary(CrossImpactReport report) {
        for (RegressionResult result : report.getRegressionResults()) {
            if (result.isOk()) {
                log.info("  {} h={} {} self={} R²={} cross/self={}",
                    result.getTargetSymbol(), result.getHorizon(), result.getMode(),
                    String.format("%.6f", result.getSelfCoefficient()),
                    result.getRSquared() == null ? "n/a" : String.format("%.4f", result.getRSquared()),
                    result.getCrossToSelfRatio() == null ? "n/a" : String.format("%.4f", result.getCrossToSelfRatio()));
            } else {
                log.warn("  {} h={} {} FAILED [{}] {}",
                    result.getTargetSymbol(), result.getHorizon(), result.getMode(),
                    result.getFailureKind(), result.getFailureReason());
            }
        }
        log.info("[RUNNER] Run {}: {} units, {} failed", report.getRunId(),
            report.getRegressionResults().size(), report.getFailedUnits());
    }
}
