package com.xammer.insights.util;

/**
 * Number rendering for human-readable messages.
 */
public final class Numbers {

    private static final double MAX_EXACT_LONG = 1e15;

    private Numbers() {
    }

    /**
     * Whole values print without a fractional part ({@code 90}, not {@code 90.0}); anything else
     * prints in its shortest round-trip form.
     */
    public static String display(double value) {
        if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_LONG) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
