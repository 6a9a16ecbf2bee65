package com.xammer.insights.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isAlerting() {
        return this == HIGH || this == CRITICAL;
    }

    @Override
    public String toString() {
        return label;
    }
}
