package com.kotsin.crossimpact.service;

import com.kotsin.crossimpact.config.AnalysisConfig;
import com.kotsin.crossimpact.data.BookSnapshotSource;
import com.kotsin.crossimpact.data.SnapshotLoadException;
import com.kotsin.crossimpact.domain.calculator.CompositeOFIReducer;
import com.kotsin.crossimpact.domain.calculator.CrossImpactDesignBuilder;
import com.kotsin.crossimpact.domain.calculator.CrossImpactMatrixBuilder;
import com.kotsin.crossimpact.domain.calculator.LevelOFIAggregator;
import com.kotsin.crossimpact.domain.calculator.LevelOFICalculator;
import com.kotsin.crossimpact.domain.calculator.PriceChangeComputer;
import com.kotsin.crossimpact.domain.calculator.RegressionEngine;
import com.kotsin.crossimpact.domain.model.BookSnapshot;
import com.kotsin.crossimpact.domain.model.CompositeReduction;
import com.kotsin.crossimpact.domain.model.CrossImpactMatrix;
import com.kotsin.crossimpact.domain.model.CrossImpactReport;
import com.kotsin.crossimpact.domain.model.DesignRow;
import com.kotsin.crossimpact.domain.model.FailureKind;
import com.kotsin.crossimpact.domain.model.ImpactMode;
import com.kotsin.crossimpact.domain.model.LevelOFIRecord;
import com.kotsin.crossimpact.domain.model.PriceChangeRecord;
import com.kotsin.crossimpact.domain.model.RegressionResult;
import com.kotsin.crossimpact.domain.model.ScreenedSnapshots;
import com.kotsin.crossimpact.domain.model.SymbolAnalysis;
import com.kotsin.crossimpact.domain.validator.SnapshotSequenceValidator;
import com.kotsin.crossimpact.logging.PipelineTraceLogger;
import com.kotsin.crossimpact.util.GridAligner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * CrossImpactAnalysisService - Runs one batch from snapshots to regression results.
 *
 * Stage 1 (per symbol, parallel on analysisExecutor): screen → level OFI → grid → PCA.
 * Barrier: every symbol's task must finish before anything cross-sectional starts.
 * Stage 2 (cross-sectional): window, forward returns, design rows, OLS, matrices.
 *
 * Failures stay inside their unit (symbol, or target × horizon × mode). The report lists
 * every requested unit, fitted or failed.
 */
@Service
@Slf4j
public class CrossImpactAnalysisService {

    private final AnalysisConfig config;
    private final SnapshotSequenceValidator validator;
    private final LevelOFIAggregator aggregator;
    private final CompositeOFIReducer reducer;
    private final PriceChangeComputer priceChangeComputer;
    private final CrossImpactDesignBuilder designBuilder;
    private final RegressionEngine regressionEngine;
    private final CrossImpactMatrixBuilder matrixBuilder;
    private final PipelineTraceLogger trace;
    private final Executor analysisExecutor;

    public CrossImpactAnalysisService(AnalysisConfig config,
                                      SnapshotSequenceValidator validator,
                                      LevelOFIAggregator aggregator,
                                      CompositeOFIReducer reducer,
                                      PriceChangeComputer priceChangeComputer,
                                      CrossImpactDesignBuilder designBuilder,
                                      RegressionEngine regressionEngine,
                                      CrossImpactMatrixBuilder matrixBuilder,
                                      PipelineTraceLogger trace,
                                      @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.config = config;
        this.validator = validator;
        this.aggregator = aggregator;
        this.reducer = reducer;
        this.priceChangeComputer = priceChangeComputer;
        this.designBuilder = designBuilder;
        this.regressionEngine = regressionEngine;
        this.matrixBuilder = matrixBuilder;
        this.trace = trace;
        this.analysisExecutor = analysisExecutor;
    }

    /**
     * Load every symbol from the source, then analyze. A symbol whose data cannot be
     * loaded is analyzed as empty (and fails with insufficient history).
     */
    public CrossImpactReport analyze(BookSnapshotSource source, Collection<String> symbols) {
        Map<String, List<BookSnapshot>> snapshots = new LinkedHashMap<>();
        for (String symbol : symbols) {
            try {
                snapshots.put(symbol, source.load(symbol));
            } catch (SnapshotLoadException e) {
                log.error("[PIPELINE] Could not load {}: {}", e.getSymbol(), e.getMessage());
                snapshots.put(symbol, List.of());
            } catch (RuntimeException e) {
                log.error("[PIPELINE] Source failed for {}: {}", symbol, e.getMessage(), e);
                snapshots.put(symbol, List.of());
            }
        }
        return analyze(snapshots);
    }

    public CrossImpactReport analyze(Map<String, List<BookSnapshot>> snapshotsBySymbol) {
        long startMs = System.currentTimeMillis();
        String runId = UUID.randomUUID().toString().substring(0, 8);
        List<String> symbols = new ArrayList<>(new TreeSet<>(snapshotsBySymbol.keySet()));
        log.info("[PIPELINE] run={} starting for {} symbols: {}", runId, symbols.size(), symbols);

        // ========== Stage 1: per-symbol, parallel ==========
        Map<String, CompletableFuture<SymbolStage>> futures = new LinkedHashMap<>();
        for (String symbol : symbols) {
            List<BookSnapshot> input = snapshotsBySymbol.get(symbol);
            CompletableFuture<SymbolStage> future;
            try {
                future = CompletableFuture
                    .supplyAsync(() -> runSymbolStage(symbol, input), analysisExecutor)
                    .exceptionally(e -> failedStage(symbol, e));
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.completedFuture(failedStage(symbol, e));
            }
            futures.put(symbol, future);
        }

        // ========== Barrier ==========
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        Map<String, SymbolStage> stages = new LinkedHashMap<>();
        futures.forEach((symbol, future) -> stages.put(symbol, future.join()));

        // ========== Stage 2: cross-sectional ==========
        Instant[] window = analysisWindow(stages.values());
        List<SymbolAnalysis> analyses = new ArrayList<>(symbols.size());
        for (SymbolStage stage : stages.values()) {
            analyses.add(toAnalysis(stage, window));
        }
        Map<String, SymbolAnalysis> bySymbol = analyses.stream()
            .collect(Collectors.toMap(SymbolAnalysis::getSymbol, a -> a));

        Map<String, NavigableMap<Instant, Double>> composite = new TreeMap<>();
        for (SymbolAnalysis analysis : analyses) {
            if (analysis.isUsable()) {
                composite.put(analysis.getSymbol(), analysis.getReduction().scoresByTimestamp());
            }
        }
        if (composite.size() < symbols.size()) {
            log.warn("[PIPELINE] run={} regression universe reduced to {} of {} symbols",
                runId, composite.size(), symbols.size());
        }

        List<RegressionResult> results = new ArrayList<>();
        for (String target : symbols) {
            for (Duration horizon : config.getHorizons()) {
                for (ImpactMode mode : ImpactMode.values()) {
                    RegressionResult result = fitUnit(bySymbol.get(target), composite, horizon, mode);
                    trace.logRegression(result);
                    results.add(result);
                }
            }
        }

        List<CrossImpactMatrix> matrices = new ArrayList<>();
        for (Duration horizon : config.getHorizons()) {
            for (ImpactMode mode : ImpactMode.values()) {
                matrices.add(matrixBuilder.build(symbols, horizon, mode, results));
            }
        }

        CrossImpactReport report = CrossImpactReport.builder()
            .runId(runId)
            .generatedAt(Instant.now())
            .binWidth(config.getGrid().getBinWidth())
            .horizons(List.copyOf(config.getHorizons()))
            .convention(config.getReturns().getConvention())
            .windowStart(window == null ? null : window[0])
            .windowEnd(window == null ? null : window[1])
            .symbols(List.copyOf(symbols))
            .symbolAnalyses(List.copyOf(analyses))
            .regressionResults(List.copyOf(results))
            .matrices(List.copyOf(matrices))
            .build();

        trace.logBatchComplete(runId, symbols.size(), results.size(), report.getFailedUnits(),
            System.currentTimeMillis() - startMs);
        return report;
    }

    private SymbolStage runSymbolStage(String symbol, List<BookSnapshot> snapshots) {
        ScreenedSnapshots screened = validator.screen(symbol, snapshots);
        trace.logScreened(screened);

        List<LevelOFIRecord> events = LevelOFICalculator.calculateSeries(screened.getAccepted());
        List<LevelOFIRecord> levelOfi = config.getGrid().isAggregateOfi() ? aggregator.aggregate(events) : events;
        trace.logLevelOfi(symbol, events.size(), levelOfi.size());

        CompositeReduction reduction = reducer.reduce(symbol, levelOfi);
        trace.logReduction(reduction);

        return new SymbolStage(symbol, screened, events.size(), levelOfi, reduction, null, null);
    }

    private SymbolStage failedStage(String symbol, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        log.error("[PIPELINE] {} per-symbol stage failed: {}", symbol, cause.getMessage(), cause);
        return new SymbolStage(symbol, null, 0, List.of(), null,
            FailureKind.UNEXPECTED_ERROR, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    /**
     * [alignDown(first accepted timestamp), alignDown(last accepted timestamp)] over all symbols,
     * or null when no symbol has data
     */
    private Instant[] analysisWindow(Collection<SymbolStage> stages) {
        Instant first = null;
        Instant last = null;
        for (SymbolStage stage : stages) {
            if (stage.screened() == null || stage.screened().getAccepted().isEmpty()) {
                continue;
            }
            List<BookSnapshot> accepted = stage.screened().getAccepted();
            Instant symbolFirst = accepted.get(0).getTimestamp();
            Instant symbolLast = accepted.get(accepted.size() - 1).getTimestamp();
            first = first == null || symbolFirst.isBefore(first) ? symbolFirst : first;
            last = last == null || symbolLast.isAfter(last) ? symbolLast : last;
        }
        if (first == null) {
            return null;
        }
        Duration binWidth = config.getGrid().getBinWidth();
        return new Instant[]{GridAligner.alignDown(first, binWidth), GridAligner.alignDown(last, binWidth)};
    }

    private SymbolAnalysis toAnalysis(SymbolStage stage, Instant[] window) {
        List<PriceChangeRecord> priceChanges = List.of();
        if (window != null && stage.screened() != null) {
            List<BookSnapshot> accepted = stage.screened().getAccepted();
            priceChanges = priceChangeComputer.computeAll(stage.symbol(), accepted, window[0], window[1]);
            trace.logReturns(stage.symbol(), accepted.size(), priceChanges.size());
        }
        return SymbolAnalysis.builder()
            .symbol(stage.symbol())
            .screening(stage.screened())
            .eventOfiCount(stage.eventCount())
            .levelOfi(stage.levelOfi())
            .reduction(stage.reduction())
            .priceChanges(List.copyOf(priceChanges))
            .failureKind(stage.failureKind())
            .failureReason(stage.failureReason())
            .build();
    }

    private RegressionResult fitUnit(SymbolAnalysis target, Map<String, NavigableMap<Instant, Double>> composite,
                                     Duration horizon, ImpactMode mode) {
        String symbol = target.getSymbol();
        if (!composite.containsKey(symbol)) {
            FailureKind kind = Objects.requireNonNullElse(target.getFailureKind(),
                target.getReduction() != null ? target.getReduction().getFailureKind() : FailureKind.INSUFFICIENT_HISTORY);
            String reason = target.getFailureReason() != null ? target.getFailureReason()
                : "composite OFI unavailable: " + (target.getReduction() != null ? target.getReduction().getFailureReason() : "no data");
            return RegressionResult.failed(symbol, horizon, mode, kind, reason, 0);
        }
        try {
            List<DesignRow> rows = designBuilder.build(composite, symbol, target.priceChangesAt(horizon), horizon, mode);
            List<String> crossSymbols = CrossImpactDesignBuilder.crossSymbols(composite.keySet(), symbol);
            return regressionEngine.fit(symbol, horizon, mode, crossSymbols, rows);
        } catch (RuntimeException e) {
            log.error("[PIPELINE] {} h={} {} failed: {}", symbol, horizon, mode, e.getMessage(), e);
            return RegressionResult.failed(symbol, horizon, mode, FailureKind.UNEXPECTED_ERROR,
                e.getClass().getSimpleName() + ": " + e.getMessage(), 0);
        }
    }

    private record SymbolStage(String symbol, ScreenedSnapshots screened, int eventCount,
                               List<LevelOFIRecord> levelOfi, CompositeReduction reduction,
                               FailureKind failureKind, String failureReason) {}
}
