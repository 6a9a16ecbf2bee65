package com.xammer.insights.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScalingRecommendation {
    ScalingAction action;
    int targetCapacity;
    String timeframe;
    double confidence;
}
