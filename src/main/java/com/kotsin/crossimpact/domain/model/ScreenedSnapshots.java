package com.kotsin.crossimpact.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Snapshots of one symbol that passed screening, with counts of what was dropped and why.
 */
@Value
@Builder
public class ScreenedSnapshots {
    String symbol;

    @JsonIgnore
    List<BookSnapshot> accepted;

    int received;
    int rejectedInvalid;
    int rejectedNonMonotonic;
    /** Snapshots kept with fewer than 5 levels. */
    int missingLevelSnapshots;
    /** True when the SORT policy had to reorder the input. */
    boolean resorted;
    List<String> sampleReasons;
    /** Warning-level failure kinds seen while screening; never fatal on their own. */
    Set<FailureKind> warnings;

    public int getAcceptedCount() {
        return accepted.size();
    }
}
