package com.kotsin.crossimpact.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Forward mid-price change of one symbol from grid point {@code timestamp} to
 * {@code timestamp + horizon}.
 */
@Value
@Builder
public class PriceChangeRecord {
    String symbol;
    Instant timestamp;
    Duration horizon;
    double priceChange;
    ReturnConvention convention;
}
