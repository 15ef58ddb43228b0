package com.dashboard.domain.model;

import java.util.List;

/**
 * A single named sequence of a {@link ColumnarDataset}.
 *
 * Implementations are immutable. {@link #select(List)} yields a new column
 * holding only the given row indices, in the order given.
 */
public interface Column<T> {

    ColumnType type();

    List<T> values();

    default int size() {
        return values().size();
    }

    default T get(int row) {
        return values().get(row);
    }

    Column<T> select(List<Integer> rows);
}
