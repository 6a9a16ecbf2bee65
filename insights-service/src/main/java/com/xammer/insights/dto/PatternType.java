package com.xammer.insights.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Periodicity found in a series. {@code DAILY} is derived from the hour-of-day profile,
 * {@code WEEKLY} from the weekday profile and {@code MONTHLY} from 7-day buckets.
 */
public enum PatternType {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    NONE("none");

    private final String label;

    PatternType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
