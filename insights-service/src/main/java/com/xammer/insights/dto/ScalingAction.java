package com.xammer.insights.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScalingAction {
    SCALE_UP("scale_up"),
    SCALE_DOWN("scale_down"),
    MAINTAIN("maintain");

    private final String label;

    ScalingAction(String label) {
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
