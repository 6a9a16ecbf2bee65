package com.xammer.insights.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AnomalyAlert {
    String id;
    Severity severity;
    String metric;
    String message;
    List<String> actions;
    Instant timestamp;
}
