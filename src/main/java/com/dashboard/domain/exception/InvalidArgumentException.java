package com.dashboard.domain.exception;

/**
 * Caller-fixable input problem, such as a malformed date.
 */
public class InvalidArgumentException extends AnalyticsException {

    private final String field;

    public InvalidArgumentException(String field, String message) {
        super(message);
        this.field = field;
    }

    public InvalidArgumentException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
