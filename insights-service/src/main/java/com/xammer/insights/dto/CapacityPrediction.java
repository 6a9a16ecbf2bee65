package com.xammer.insights.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CapacityPrediction {
    String service;
    int currentCapacity;
    double predictedDemand;
    ScalingRecommendation recommendedScaling;
    CostImpact costImpact;
}
