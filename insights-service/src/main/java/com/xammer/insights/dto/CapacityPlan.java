package com.xammer.insights.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Capacity predictions for a set of services together with the roll-ups a planning
 * dashboard needs.
 */
@Value
@Builder
public class CapacityPlan {
    @Singular
    List<CapacityPrediction> predictions;
    CostOptimization costOptimization;
    @Singular
    List<PlannedScalingAction> scalingActions;
    @Singular
    List<String> recommendations;
}
