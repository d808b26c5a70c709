package com.kotsin.crossimpact.data;

import com.kotsin.crossimpact.domain.model.BookSnapshot;

import java.util.List;

/**
 * Supplies one symbol's book snapshots in time order, fully materialized.
 */
public interface BookSnapshotSource {

    /**
     * @return the snapshots, empty when the symbol has no data
     * @throws SnapshotLoadException when the underlying data cannot be read or parsed
     */
    List<BookSnapshot> load(String symbol);
}
