package com.xammer.insights.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LatencyProfile {
    double averageLatency;
    double p95Latency;
    double p99Latency;
    double efficiency;   // 1 at zero latency, 0 at 100ms and above
}
