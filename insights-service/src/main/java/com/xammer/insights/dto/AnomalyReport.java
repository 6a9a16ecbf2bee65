package com.xammer.insights.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnomalyReport {
    @Singular
    List<AnomalyRecord> anomalies;
    AnomalySummary summary;
    @Singular
    List<AnomalyAlert> alerts;
}
