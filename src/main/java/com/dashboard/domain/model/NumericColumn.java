package com.dashboard.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class NumericColumn implements Column<Number> {

    private final List<Number> values;

    public NumericColumn(List<? extends Number> values) {
        List<Number> copy = new ArrayList<>(values.size());
        for (Number value : values) {
            copy.add(Objects.requireNonNull(value, "numeric column values must not be null"));
        }
        this.values = Collections.unmodifiableList(copy);
    }

    @Override
    public ColumnType type() {
        return ColumnType.NUMERIC;
    }

    @Override
    public List<Number> values() {
        return values;
    }

    @Override
    public NumericColumn select(List<Integer> rows) {
        List<Number> selected = new ArrayList<>(rows.size());
        for (int row : rows) {
            selected.add(values.get(row));
        }
        return new NumericColumn(selected);
    }
}
