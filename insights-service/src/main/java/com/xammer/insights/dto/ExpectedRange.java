package com.xammer.insights.dto;

import lombok.Value;

@Value
public class ExpectedRange {
    double min;
    double max;

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
