package com.dashboard.domain.exception;

/**
 * Base type for failures raised by the analytics engine.
 */
public abstract class AnalyticsException extends RuntimeException {

    protected AnalyticsException(String message) {
        super(message);
    }

    protected AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
