package com.xammer.insights.exception;

/**
 * Raised when the shape of the input is wrong, e.g. parallel sequences of different lengths.
 */
public class InvalidInputException extends AnalyticsException {

    public InvalidInputException(String message) {
        super(message);
    }
}
