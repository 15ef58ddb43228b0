package com.dashboard.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Calendar timestamps, held without a zone.
 */
public final class TemporalColumn implements Column<LocalDateTime> {

    private final List<LocalDateTime> values;

    public TemporalColumn(List<? extends LocalDateTime> values) {
        List<LocalDateTime> copy = new ArrayList<>(values.size());
        for (LocalDateTime value : values) {
            copy.add(Objects.requireNonNull(value, "temporal column values must not be null"));
        }
        this.values = Collections.unmodifiableList(copy);
    }

    @Override
    public ColumnType type() {
        return ColumnType.TEMPORAL;
    }

    @Override
    public List<LocalDateTime> values() {
        return values;
    }

    @Override
    public TemporalColumn select(List<Integer> rows) {
        List<LocalDateTime> selected = new ArrayList<>(rows.size());
        for (int row : rows) {
            selected.add(values.get(row));
        }
        return new TemporalColumn(selected);
    }
}
