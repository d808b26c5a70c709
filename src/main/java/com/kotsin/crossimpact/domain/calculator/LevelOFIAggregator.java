package com.kotsin.crossimpact.domain.calculator;

import com.kotsin.crossimpact.config.AnalysisConfig;
import com.kotsin.crossimpact.domain.model.LevelOFIRecord;
import com.kotsin.crossimpact.util.GridAligner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * LevelOFIAggregator - Sums per-event level OFI onto the common calendar grid.
 *
 * An event at τ belongs to the bin labelled t with t < τ <= t + binWidth, so the
 * gridded OFI at t measures flow over the same interval as the one-bin return from t.
 * Empty bins emit nothing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LevelOFIAggregator {

    private final AnalysisConfig config;

    public List<LevelOFIRecord> aggregate(List<LevelOFIRecord> events) {
        return aggregate(events, config.getGrid().getBinWidth());
    }

    public static List<LevelOFIRecord> aggregate(List<LevelOFIRecord> events, Duration binWidth) {
        if (events.isEmpty()) {
            return List.of();
        }
        String symbol = events.get(0).getSymbol();

        Map<Instant, double[]> sums = new TreeMap<>();
        Map<Instant, Integer> missing = new TreeMap<>();
        for (LevelOFIRecord event : events) {
            if (!symbol.equals(event.getSymbol())) {
                throw new IllegalArgumentException("Mixed symbols in one series: " + symbol + " and " + event.getSymbol());
            }
            Instant bin = GridAligner.binStartExclusive(event.getTimestamp(), binWidth);
            double[] sum = sums.computeIfAbsent(bin, k -> new double[event.depth()]);
            for (int n = 1; n <= event.depth(); n++) {
                sum[n - 1] += event.level(n);
            }
            missing.merge(bin, event.getMissingLevels(), Math::max);
        }

        List<LevelOFIRecord> gridded = new ArrayList<>(sums.size());
        for (Map.Entry<Instant, double[]> entry : sums.entrySet()) {
            gridded.add(LevelOFIRecord.builder()
                .symbol(symbol)
                .timestamp(entry.getKey())
                .levelOfi(entry.getValue())
                .missingLevels(missing.get(entry.getKey()))
                .build());
        }

        log.debug("[OFI-GRID] {} events={} bins={} binWidth={}", symbol, events.size(), gridded.size(), binWidth);
        return gridded;
    }
}
