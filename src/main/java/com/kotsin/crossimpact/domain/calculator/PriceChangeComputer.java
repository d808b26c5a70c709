package com.kotsin.crossimpact.domain.calculator;

import com.kotsin.crossimpact.config.AnalysisConfig;
import com.kotsin.crossimpact.domain.model.BookSnapshot;
import com.kotsin.crossimpact.domain.model.PriceChangeRecord;
import com.kotsin.crossimpact.domain.model.ReturnConvention;
import com.kotsin.crossimpact.util.GridAligner;
import com.kotsin.crossimpact.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * PriceChangeComputer - Forward mid-price changes on the common calendar grid.
 *
 * The mid at grid point g is the last observed mid at or before g (forward fill, no
 * look-ahead). Snapshots without a valid two-sided quote never update the mid.
 * Grid points with no prior observation, or whose horizon end falls outside the
 * window, produce no record.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PriceChangeComputer {

    private final AnalysisConfig config;

    /**
     * Forward-filled mid price at every grid point of [windowStart, windowEnd] that has a prior observation
     */
    public NavigableMap<Instant, Double> midPriceGrid(List<BookSnapshot> snapshots, Instant windowStart, Instant windowEnd) {
        Duration binWidth = config.getGrid().getBinWidth();
        NavigableMap<Instant, Double> grid = new TreeMap<>();

        int next = 0;
        double lastMid = Double.NaN;
        for (Instant point : GridAligner.gridPoints(windowStart, windowEnd, binWidth)) {
            while (next < snapshots.size() && !snapshots.get(next).getTimestamp().isAfter(point)) {
                double mid = snapshots.get(next).midPrice();
                if (MathUtils.isValidPositive(mid)) {
                    lastMid = mid;
                }
                next++;
            }
            if (!Double.isNaN(lastMid)) {
                grid.put(point, lastMid);
            }
        }
        return grid;
    }

    public List<PriceChangeRecord> compute(String symbol, List<BookSnapshot> snapshots,
                                           Instant windowStart, Instant windowEnd, Duration horizon) {
        return compute(symbol, midPriceGrid(snapshots, windowStart, windowEnd), horizon);
    }

    /**
     * Forward changes from an already forward-filled mid grid
     */
    public List<PriceChangeRecord> compute(String symbol, NavigableMap<Instant, Double> midGrid, Duration horizon) {
        if (horizon == null || horizon.isZero() || horizon.isNegative()) {
            throw new IllegalArgumentException("Horizon must be positive: " + horizon);
        }
        ReturnConvention convention = config.getReturns().getConvention();

        List<PriceChangeRecord> changes = new ArrayList<>();
        for (var entry : midGrid.entrySet()) {
            Double end = midGrid.get(entry.getKey().plus(horizon));
            if (end == null) {
                continue;
            }
            double change = convention.apply(entry.getValue(), end);
            if (!MathUtils.isValidNumber(change)) {
                continue;
            }
            changes.add(PriceChangeRecord.builder()
                .symbol(symbol)
                .timestamp(entry.getKey())
                .horizon(horizon)
                .priceChange(change)
                .convention(convention)
                .build());
        }

        log.debug("[RETURNS] {} horizon={} gridPoints={} changes={}", symbol, horizon, midGrid.size(), changes.size());
        return changes;
    }

    /**
     * All configured horizons, ordered by horizon then timestamp
     */
    public List<PriceChangeRecord> computeAll(String symbol, List<BookSnapshot> snapshots,
                                              Instant windowStart, Instant windowEnd) {
        NavigableMap<Instant, Double> midGrid = midPriceGrid(snapshots, windowStart, windowEnd);
        List<PriceChangeRecord> all = new ArrayList<>();
        for (Duration horizon : config.getHorizons()) {
            all.addAll(compute(symbol, midGrid, horizon));
        }
        return all;
    }
}
