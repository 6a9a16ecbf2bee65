package com.xammer.insights.rules;

import java.util.Arrays;
import java.util.Optional;

/**
 * Metrics the rule tables have dedicated text for. Anything else gets the generic fallback.
 */
public enum MetricKind {
    CPU_UTILIZATION("cpu_utilization"),
    MEMORY_UTILIZATION("memory_utilization"),
    NETWORK_LATENCY("network_latency"),
    ERROR_RATE("error_rate");

    private final String metricName;

    MetricKind(String metricName) {
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }

    public static Optional<MetricKind> fromMetricName(String metricName) {
        return Arrays.stream(values())
                .filter(kind -> kind.metricName.equals(metricName))
                .findFirst();
    }
}
