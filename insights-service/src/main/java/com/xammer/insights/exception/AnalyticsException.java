package com.xammer.insights.exception;

/**
 * Base type for precondition failures raised by the analytics engine.
 * Callers translate these into user-facing messages.
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }
}
