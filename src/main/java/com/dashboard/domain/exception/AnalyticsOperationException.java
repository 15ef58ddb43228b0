package com.dashboard.domain.exception;

/**
 * Unexpected fault inside an engine operation.
 *
 * The message carries the operation and slot only; the cause keeps the detail for logs.
 */
public class AnalyticsOperationException extends AnalyticsException {

    private final String operation;
    private final String slot;

    public AnalyticsOperationException(String operation, String slot, Throwable cause) {
        super(operation + " failed for slot '" + slot + "'", cause);
        this.operation = operation;
        this.slot = slot;
    }

    public String operation() {
        return operation;
    }

    public String slot() {
        return slot;
    }
}
