package com.xammer.insights.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SeasonalPattern {
    public static final SeasonalPattern NONE = SeasonalPattern.builder()
            .pattern(PatternType.NONE)
            .seasonalityStrength(0)
            .build();

    PatternType pattern;
    List<Integer> peakHours;
    List<String> peakDays;
    double seasonalityStrength;
    Instant nextPeakPrediction;
}
