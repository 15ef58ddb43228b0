package com.dashboard.domain.exception;

import com.dashboard.domain.model.DatasetKind;

/**
 * The analytics data source could not produce a snapshot.
 */
public class DataSourceUnavailableException extends AnalyticsException {

    private final DatasetKind kind;

    public DataSourceUnavailableException(DatasetKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DataSourceUnavailableException(DatasetKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public DatasetKind kind() {
        return kind;
    }
}
