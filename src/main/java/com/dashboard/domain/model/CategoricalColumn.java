package com.dashboard.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class CategoricalColumn implements Column<String> {

    private final List<String> values;

    public CategoricalColumn(List<String> values) {
        List<String> copy = new ArrayList<>(values.size());
        for (String value : values) {
            copy.add(Objects.requireNonNull(value, "categorical column values must not be null"));
        }
        this.values = Collections.unmodifiableList(copy);
    }

    @Override
    public ColumnType type() {
        return ColumnType.CATEGORICAL;
    }

    @Override
    public List<String> values() {
        return values;
    }

    @Override
    public CategoricalColumn select(List<Integer> rows) {
        List<String> selected = new ArrayList<>(rows.size());
        for (int row : rows) {
            selected.add(values.get(row));
        }
        return new CategoricalColumn(selected);
    }
}
