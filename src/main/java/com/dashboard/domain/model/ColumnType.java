package com.dashboard.domain.model;

public enum ColumnType {
    TEMPORAL,
    CATEGORICAL,
    NUMERIC
}
