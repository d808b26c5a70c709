package com.kotsin.crossimpact.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * BookSnapshot - State of the top of one symbol's limit order book at a point in time.
 *
 * Levels are ranked best-to-worst (index 0 = level 1). At most {@link #MAX_LEVELS}
 * levels are kept; venues reporting fewer levels simply produce a shorter list.
 *
 * Invariant (checked by SnapshotSequenceValidator, not here):
 * - bidPrice(level i) <= bidPrice(level i-1)
 * - askPrice(level i) >= askPrice(level i-1)
 */
@Value
@Builder
public class BookSnapshot {

    public static final int MAX_LEVELS = 5;

    String symbol;
    Instant timestamp;
    @Singular
    List<BookLevel> levels;

    public int levelCount() {
        return levels.size();
    }

    /**
     * @param n 1-based level rank
     * @return the level, or null when the venue did not report that depth
     */
    public BookLevel level(int n) {
        if (n < 1 || n > levels.size()) {
            return null;
        }
        return levels.get(n - 1);
    }

    public double bestBid() {
        return levels.isEmpty() ? Double.NaN : levels.get(0).getBidPrice();
    }

    public double bestAsk() {
        return levels.isEmpty() ? Double.NaN : levels.get(0).getAskPrice();
    }

    /**
     * Mid price of the best quotes, NaN when the book has no two-sided quote.
     */
    public double midPrice() {
        if (!hasTwoSidedQuote()) {
            return Double.NaN;
        }
        return (bestBid() + bestAsk()) / 2.0;
    }

    /**
     * True when level 1 has positive prices on both sides and the book is not crossed.
     */
    public boolean hasTwoSidedQuote() {
        if (levels.isEmpty()) {
            return false;
        }
        double bid = bestBid();
        double ask = bestAsk();
        return bid > 0 && ask > 0 && bid <= ask;
    }
}
