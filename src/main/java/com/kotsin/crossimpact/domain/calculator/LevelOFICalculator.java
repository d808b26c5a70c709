package com.kotsin.crossimpact.domain.calculator;

import com.kotsin.crossimpact.domain.model.BookLevel;
import com.kotsin.crossimpact.domain.model.BookSnapshot;
import com.kotsin.crossimpact.domain.model.LevelOFIRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * LevelOFICalculator - Multi-level Order Flow Imbalance
 *
 * Per level n, between consecutive snapshots (t-1, t) of one symbol:
 *
 *   bid(n) = bidSize(t)              if bidPrice(t) >  bidPrice(t-1)
 *            bidSize(t) - bidSize(t-1) if bidPrice(t) == bidPrice(t-1)
 *            -bidSize(t-1)            if bidPrice(t) <  bidPrice(t-1)
 *
 *   ask(n) = askSize(t)              if askPrice(t) <  askPrice(t-1)
 *            askSize(t) - askSize(t-1) if askPrice(t) == askPrice(t-1)
 *            -askSize(t-1)            if askPrice(t) >  askPrice(t-1)
 *
 *   OFI(n, t) = bid(n) - ask(n)
 *
 * Interpretation:
 * - OFI > 0: Buying pressure (bids building or asks depleting)
 * - OFI < 0: Selling pressure
 *
 * A level missing from either snapshot contributes 0.
 *
 * References:
 * - Cont, R., Kukanov, A., & Stoikov, S. (2014). "The Price Impact of Order Book Events"
 * - Cont, R., Cucuringu, M., & Zhang, C. (2023). "Cross-impact of order flow imbalance in equity markets"
 */
public final class LevelOFICalculator {

    public static final int LEVELS = BookSnapshot.MAX_LEVELS;

    private LevelOFICalculator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Calculate the 5-level OFI vector between two consecutive snapshots of the same symbol
     *
     * @param previous snapshot at t-1
     * @param current  snapshot at t
     * @return record stamped with the current snapshot's timestamp
     */
    public static LevelOFIRecord calculate(BookSnapshot previous, BookSnapshot current) {
        if (previous == null || current == null) {
            throw new IllegalArgumentException("Both snapshots are required");
        }
        if (!previous.getSymbol().equals(current.getSymbol())) {
            throw new IllegalArgumentException("Snapshots belong to different symbols: "
                + previous.getSymbol() + " vs " + current.getSymbol());
        }

        double[] ofi = new double[LEVELS];
        int missing = 0;
        for (int n = 1; n <= LEVELS; n++) {
            BookLevel prev = previous.level(n);
            BookLevel curr = current.level(n);
            if (prev == null || curr == null) {
                missing++;
                continue;
            }
            ofi[n - 1] = bidContribution(prev, curr) - askContribution(prev, curr);
        }

        return LevelOFIRecord.builder()
            .symbol(current.getSymbol())
            .timestamp(current.getTimestamp())
            .levelOfi(ofi)
            .missingLevels(missing)
            .build();
    }

    /**
     * Bid-side flow at one level: new/added bid volume is positive, removed volume negative
     */
    public static double bidContribution(BookLevel previous, BookLevel current) {
        int cmp = Double.compare(current.getBidPrice(), previous.getBidPrice());
        if (cmp > 0) {
            return current.getBidSize();
        } else if (cmp == 0) {
            return (double) current.getBidSize() - previous.getBidSize();
        }
        return -(double) previous.getBidSize();
    }

    /**
     * Ask-side flow at one level, mirrored: a lower ask price means new supply
     */
    public static double askContribution(BookLevel previous, BookLevel current) {
        int cmp = Double.compare(current.getAskPrice(), previous.getAskPrice());
        if (cmp < 0) {
            return current.getAskSize();
        } else if (cmp == 0) {
            return (double) current.getAskSize() - previous.getAskSize();
        }
        return -(double) previous.getAskSize();
    }

    /**
     * Calculate the level OFI series of one symbol.
     *
     * The first snapshot has no predecessor and yields nothing, so n snapshots give
     * n-1 records, in input order. Input must already be screened (strictly increasing).
     */
    public static List<LevelOFIRecord> calculateSeries(List<BookSnapshot> snapshots) {
        List<LevelOFIRecord> series = new ArrayList<>(Math.max(0, snapshots.size() - 1));
        for (int i = 1; i < snapshots.size(); i++) {
            BookSnapshot previous = snapshots.get(i - 1);
            BookSnapshot current = snapshots.get(i);
            if (!current.getTimestamp().isAfter(previous.getTimestamp())) {
                throw new IllegalArgumentException("Snapshots of " + current.getSymbol()
                    + " are not strictly increasing at " + current.getTimestamp());
            }
            series.add(calculate(previous, current));
        }
        return series;
    }
}
