package com.kotsin.crossimpact.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything the per-symbol stage produced for one symbol.
 */
@Value
@Builder
public class SymbolAnalysis {
    String symbol;
    ScreenedSnapshots screening;
    int eventOfiCount;
    List<LevelOFIRecord> levelOfi;
    CompositeReduction reduction;
    List<PriceChangeRecord> priceChanges;

    /** Set when the symbol's task raised instead of completing. */
    FailureKind failureKind;
    String failureReason;

    public boolean isUsable() {
        return failureKind == null && reduction != null && reduction.isSuccessful();
    }

    public List<PriceChangeRecord> priceChangesAt(Duration horizon) {
        return priceChanges.stream()
            .filter(p -> p.getHorizon().equals(horizon))
            .collect(Collectors.toList());
    }
}
