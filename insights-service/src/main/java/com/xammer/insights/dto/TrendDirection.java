package com.xammer.insights.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String label;

    TrendDirection(String label) {
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
