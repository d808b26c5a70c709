package com.kotsin.crossimpact.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One ranked price level of a book snapshot (both sides at the same rank).
 */
@Value
@Builder
public class BookLevel {
    double bidPrice;
    long bidSize;
    double askPrice;
    long askSize;

    public static BookLevel of(double bidPrice, long bidSize, double askPrice, long askSize) {
        return new BookLevel(bidPrice, bidSize, askPrice, askSize);
    }
}
