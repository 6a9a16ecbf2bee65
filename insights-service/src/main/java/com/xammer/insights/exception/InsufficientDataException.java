package com.xammer.insights.exception;

import lombok.Getter;

/**
 * Raised when a series is shorter than the operation's minimum length.
 */
@Getter
public class InsufficientDataException extends AnalyticsException {

    private final int available;
    private final int required;

    public InsufficientDataException(String operation, int available, int required) {
        super("Insufficient data for " + operation + ": " + available + " data points available, at least "
                + required + " required");
        this.available = available;
        this.required = required;
    }
}
