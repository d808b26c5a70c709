package com.kotsin.crossimpact.domain.calculator;

import com.kotsin.crossimpact.domain.model.DesignRow;
import com.kotsin.crossimpact.domain.model.ImpactMode;
import com.kotsin.crossimpact.domain.model.PriceChangeRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * CrossImpactDesignBuilder - Timestamp-keyed alignment of composite OFI across symbols.
 *
 * For a target, horizon h and mode, each target return over [t, t+h] is paired with every
 * symbol's composite OFI at t (CONTEMPORANEOUS) or t-h (LAGGED).
 *
 * Alignment policy: a row is emitted only if the target return and every symbol's OFI
 * exist at the required timestamps. Incomplete rows are dropped, never imputed, so the
 * design matrix is always dense.
 */
@Component
@Slf4j
public class CrossImpactDesignBuilder {

    /**
     * @param compositeBySymbol composite OFI per symbol of the regression universe (must contain the target)
     * @param targetSymbol      symbol whose return is explained
     * @param targetReturns     target's forward changes at {@code horizon}
     */
    public List<DesignRow> build(Map<String, ? extends Map<Instant, Double>> compositeBySymbol,
                                 String targetSymbol, List<PriceChangeRecord> targetReturns,
                                 Duration horizon, ImpactMode mode) {
        Map<Instant, Double> self = compositeBySymbol.get(targetSymbol);
        if (self == null) {
            throw new IllegalArgumentException("No composite OFI series for target " + targetSymbol);
        }
        List<String> crossSymbols = crossSymbols(compositeBySymbol.keySet(), targetSymbol);

        List<DesignRow> rows = new ArrayList<>();
        int dropped = 0;
        for (PriceChangeRecord change : targetReturns) {
            if (!targetSymbol.equals(change.getSymbol()) || !horizon.equals(change.getHorizon())) {
                throw new IllegalArgumentException("Return " + change.getSymbol() + "/" + change.getHorizon()
                    + " does not match target " + targetSymbol + "/" + horizon);
            }
            Instant ofiTime = mode.ofiTimestamp(change.getTimestamp(), horizon);

            Double selfOfi = self.get(ofiTime);
            if (selfOfi == null) {
                dropped++;
                continue;
            }
            Map<String, Double> cross = new LinkedHashMap<>();
            for (String symbol : crossSymbols) {
                Double value = compositeBySymbol.get(symbol).get(ofiTime);
                if (value == null) {
                    break;
                }
                cross.put(symbol, value);
            }
            if (cross.size() != crossSymbols.size()) {
                dropped++;
                continue;
            }

            rows.add(DesignRow.builder()
                .timestamp(change.getTimestamp())
                .targetSymbol(targetSymbol)
                .horizon(horizon)
                .mode(mode)
                .targetReturn(change.getPriceChange())
                .selfOfi(selfOfi)
                .crossOfi(Collections.unmodifiableMap(cross))
                .build());
        }

        rows.sort((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));
        log.debug("[DESIGN] {} horizon={} mode={} rows={} dropped={} crossSymbols={}",
            targetSymbol, horizon, mode, rows.size(), dropped, crossSymbols.size());
        return rows;
    }

    /**
     * Cross symbols of a target in design-column order
     */
    public static List<String> crossSymbols(Iterable<String> universe, String targetSymbol) {
        TreeSet<String> sorted = new TreeSet<>();
        universe.forEach(sorted::add);
        sorted.remove(targetSymbol);
        return new ArrayList<>(sorted);
    }
}
