package com.xammer.insights.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    ActionPriority(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
