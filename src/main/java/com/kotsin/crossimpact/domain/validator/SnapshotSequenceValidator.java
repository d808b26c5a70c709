package com.kotsin.crossimpact.domain.validator;

import com.kotsin.crossimpact.config.AnalysisConfig;
import com.kotsin.crossimpact.domain.model.BookLevel;
import com.kotsin.crossimpact.domain.model.BookSnapshot;
import com.kotsin.crossimpact.domain.model.FailureKind;
import com.kotsin.crossimpact.domain.model.ScreenedSnapshots;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * SnapshotSequenceValidator - Screens one symbol's snapshots before OFI computation.
 *
 * Checks:
 * - level price ordering (bids non-increasing, asks non-decreasing) and non-negative values
 * - symbol matches the series key
 * - strictly increasing timestamps (REJECT or SORT policy)
 * - depth below 5 levels (kept, counted as missing level data)
 *
 * The input list is never modified; accepted snapshots are returned in a new list.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SnapshotSequenceValidator {

    private final AnalysisConfig config;

    public ScreenedSnapshots screen(String symbol, List<BookSnapshot> snapshots) {
        Objects.requireNonNull(symbol, "symbol");
        List<BookSnapshot> input = snapshots == null ? List.of() : snapshots;
        int maxReasons = config.getSnapshots().getMaxLoggedRejections();

        List<String> reasons = new ArrayList<>();
        List<BookSnapshot> wellFormed = new ArrayList<>(input.size());
        int rejectedInvalid = 0;
        int missingLevels = 0;

        for (BookSnapshot snapshot : input) {
            List<String> violations = validate(symbol, snapshot);
            if (!violations.isEmpty()) {
                rejectedInvalid++;
                if (reasons.size() < maxReasons) {
                    reasons.add(violations.get(0));
                }
                continue;
            }
            if (snapshot.levelCount() < BookSnapshot.MAX_LEVELS) {
                missingLevels++;
            }
            wellFormed.add(snapshot);
        }

        boolean resorted = false;
        int rejectedNonMonotonic = 0;
        List<BookSnapshot> accepted;

        if (config.getSnapshots().getNonMonotonicPolicy() == AnalysisConfig.NonMonotonicPolicy.SORT) {
            List<BookSnapshot> sorted = new ArrayList<>(wellFormed);
            sorted.sort(Comparator.comparing(BookSnapshot::getTimestamp));
            resorted = !sorted.equals(wellFormed);
            accepted = new ArrayList<>(sorted.size());
            for (BookSnapshot snapshot : sorted) {
                int last = accepted.size() - 1;
                if (last >= 0 && accepted.get(last).getTimestamp().equals(snapshot.getTimestamp())) {
                    // Duplicate timestamp: the later arrival wins
                    accepted.set(last, snapshot);
                    rejectedNonMonotonic++;
                } else {
                    accepted.add(snapshot);
                }
            }
            if (resorted) {
                log.warn("[SCREEN] {} snapshots arrived out of order and were re-sorted before processing", symbol);
            }
        } else {
            accepted = new ArrayList<>(wellFormed.size());
            for (BookSnapshot snapshot : wellFormed) {
                if (!accepted.isEmpty()
                    && !snapshot.getTimestamp().isAfter(accepted.get(accepted.size() - 1).getTimestamp())) {
                    rejectedNonMonotonic++;
                    if (reasons.size() < maxReasons) {
                        reasons.add(String.format("%s: timestamp %s not after %s", symbol,
                            snapshot.getTimestamp(), accepted.get(accepted.size() - 1).getTimestamp()));
                    }
                    continue;
                }
                accepted.add(snapshot);
            }
        }

        if (rejectedInvalid > 0 || rejectedNonMonotonic > 0) {
            log.warn("[SCREEN] {} received={} accepted={} invalid={} nonMonotonic={} reasons={}",
                symbol, input.size(), accepted.size(), rejectedInvalid, rejectedNonMonotonic, reasons);
        } else {
            log.debug("[SCREEN] {} received={} accepted={} shallow={}", symbol, input.size(), accepted.size(), missingLevels);
        }

        EnumSet<FailureKind> warnings = EnumSet.noneOf(FailureKind.class);
        if (rejectedInvalid > 0) {
            warnings.add(FailureKind.INVALID_SNAPSHOT);
        }
        if (rejectedNonMonotonic > 0 || resorted) {
            warnings.add(FailureKind.NON_MONOTONIC_TIMESTAMP);
        }
        if (missingLevels > 0) {
            warnings.add(FailureKind.MISSING_LEVEL_DATA);
        }

        return ScreenedSnapshots.builder()
            .symbol(symbol)
            .accepted(List.copyOf(accepted))
            .received(input.size())
            .rejectedInvalid(rejectedInvalid)
            .rejectedNonMonotonic(rejectedNonMonotonic)
            .missingLevelSnapshots(missingLevels)
            .resorted(resorted)
            .sampleReasons(List.copyOf(reasons))
            .warnings(Collections.unmodifiableSet(warnings))
            .build();
    }

    /**
     * Validate a single snapshot and return its violations (empty when valid)
     */
    public static List<String> validate(String symbol, BookSnapshot snapshot) {
        List<String> violations = new ArrayList<>();
        if (snapshot == null) {
            violations.add(symbol + ": snapshot is null");
            return violations;
        }
        if (snapshot.getTimestamp() == null) {
            violations.add(symbol + ": snapshot has no timestamp");
        }
        if (!symbol.equals(snapshot.getSymbol())) {
            violations.add(String.format("%s: snapshot belongs to %s", symbol, snapshot.getSymbol()));
        }
        if (snapshot.levelCount() > BookSnapshot.MAX_LEVELS) {
            violations.add(String.format("%s: %d levels reported, at most %d supported",
                symbol, snapshot.levelCount(), BookSnapshot.MAX_LEVELS));
        }

        BookLevel previous = null;
        for (int n = 1; n <= snapshot.levelCount(); n++) {
            BookLevel level = snapshot.level(n);
            if (level.getBidPrice() < 0 || level.getAskPrice() < 0
                || level.getBidSize() < 0 || level.getAskSize() < 0) {
                violations.add(String.format("%s@%s: negative price or size at level %d",
                    symbol, snapshot.getTimestamp(), n));
            }
            if (!Double.isFinite(level.getBidPrice()) || !Double.isFinite(level.getAskPrice())) {
                violations.add(String.format("%s@%s: non-finite price at level %d",
                    symbol, snapshot.getTimestamp(), n));
            }
            if (previous != null) {
                if (level.getBidPrice() > previous.getBidPrice()) {
                    violations.add(String.format("%s@%s: bid level %d (%.4f) above level %d (%.4f)",
                        symbol, snapshot.getTimestamp(), n, level.getBidPrice(), n - 1, previous.getBidPrice()));
                }
                if (level.getAskPrice() < previous.getAskPrice()) {
                    violations.add(String.format("%s@%s: ask level %d (%.4f) below level %d (%.4f)",
                        symbol, snapshot.getTimestamp(), n, level.getAskPrice(), n - 1, previous.getAskPrice()));
                }
            }
            previous = level;
        }
        return violations;
    }
}
