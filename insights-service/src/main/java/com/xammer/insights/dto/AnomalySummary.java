package com.xammer.insights.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AnomalySummary {
    int total;
    int critical;
    int high;
    int medium;
    int low;
}
