package com.xammer.insights.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a trend analysis for one metric series.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrendResult {
    String metricName;
    double currentValue;
    double predictedValue;
    TrendDirection trend;
    double confidence;
    String recommendedAction;
    Double timeToThreshold;        // absent unless the series is rising
    PatternType seasonalPattern;
    Double anomalyScore;
}
