package com.xammer.insights.dto;

import lombok.Value;

/**
 * Result of the autocorrelation-only periodicity check.
 */
@Value
public class SeasonalityCheck {
    public static final SeasonalityCheck NONE = new SeasonalityCheck(PatternType.NONE, 0);

    PatternType pattern;
    double strength;
}
