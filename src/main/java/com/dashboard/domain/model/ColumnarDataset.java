package com.dashboard.domain.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, row-aligned set of named columns.
 *
 * Exactly one column, {@link #TIMESTAMP}, is temporal. Every other column is
 * categorical or numeric. Narrowing operations return a new dataset and never
 * touch this one.
 */
public final class ColumnarDataset {

    public static final String TIMESTAMP = "timestamp";

    private final Map<String, Column<?>> columns;
    private final int rowCount;

    private ColumnarDataset(Map<String, Column<?>> columns) {
        Column<?> timestamp = columns.get(TIMESTAMP);
        if (timestamp == null) {
            throw new IllegalArgumentException("Dataset requires a '" + TIMESTAMP + "' column");
        }
        if (timestamp.type() != ColumnType.TEMPORAL) {
            throw new IllegalArgumentException("Column '" + TIMESTAMP + "' must be temporal");
        }
        for (Map.Entry<String, Column<?>> entry : columns.entrySet()) {
            if (!TIMESTAMP.equals(entry.getKey()) && entry.getValue().type() == ColumnType.TEMPORAL) {
                throw new IllegalArgumentException("Only '" + TIMESTAMP + "' may be temporal, found: " + entry.getKey());
            }
            if (entry.getValue().size() != timestamp.size()) {
                throw new IllegalArgumentException("Column '" + entry.getKey() + "' has "
                        + entry.getValue().size() + " rows, expected " + timestamp.size());
            }
        }
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.rowCount = timestamp.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public Set<String> columnNames() {
        return columns.keySet();
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Column<?> column(String name) {
        return columns.get(name);
    }

    public List<LocalDateTime> timestamps() {
        return ((TemporalColumn) columns.get(TIMESTAMP)).values();
    }

    /**
     * Names of the categorical columns, in column order.
     */
    public List<String> categoricalColumnNames() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Column<?>> entry : columns.entrySet()) {
            if (entry.getValue().type() == ColumnType.CATEGORICAL) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    /**
     * New dataset with only the named columns, restricted to the given rows.
     */
    public ColumnarDataset select(List<String> columnNames, List<Integer> rows) {
        Builder builder = builder();
        for (String name : columnNames) {
            Column<?> column = columns.get(name);
            if (column == null) {
                throw new IllegalArgumentException("Unknown column: " + name);
            }
            builder.column(name, column.select(rows));
        }
        return builder.build();
    }

    /**
     * Column name to plain value list, with timestamps rendered as ISO-8601 strings.
     */
    public Map<String, List<Object>> toWireFormat() {
        Map<String, List<Object>> wire = new LinkedHashMap<>();
        for (Map.Entry<String, Column<?>> entry : columns.entrySet()) {
            List<Object> values = new ArrayList<>(rowCount);
            for (Object value : entry.getValue().values()) {
                values.add(value instanceof LocalDateTime
                        ? DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((LocalDateTime) value)
                        : value);
            }
            wire.put(entry.getKey(), values);
        }
        return wire;
    }

    public static final class Builder {

        private final Map<String, Column<?>> columns = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder timestamps(List<LocalDateTime> values) {
            return column(TIMESTAMP, new TemporalColumn(values));
        }

        public Builder categorical(String name, List<String> values) {
            return column(name, new CategoricalColumn(values));
        }

        public Builder numeric(String name, List<? extends Number> values) {
            return column(name, new NumericColumn(values));
        }

        public Builder column(String name, Column<?> column) {
            if (columns.putIfAbsent(name, column) != null) {
                throw new IllegalArgumentException("Duplicate column: " + name);
            }
            return this;
        }

        public ColumnarDataset build() {
            return new ColumnarDataset(columns);
        }
    }
}
