package com.xammer.insights.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnomalyRecord {
    String metric;
    double value;
    ExpectedRange expectedRange;
    double anomalyScore;
    Severity severity;
    @Singular
    List<String> possibleCauses;
    @Singular
    List<String> recommendedActions;
}
