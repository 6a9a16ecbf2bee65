package com.xammer.insights.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PlannedScalingAction {
    String service;
    ScalingAction action;
    String timeframe;
    ActionPriority priority;
}
