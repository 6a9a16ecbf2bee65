package com.xammer.insights.rules;

import com.xammer.insights.dto.TrendDirection;

/**
 * Recommendation text keyed by metric and trend direction. The switch expressions are
 * exhaustive, so adding a {@link MetricKind} or {@link TrendDirection} fails compilation
 * until the table covers it.
 */
public final class TrendRecommendations {

    private TrendRecommendations() {
    }

    public static String recommend(String metricName, TrendDirection trend, double predictedValue) {
        return MetricKind.fromMetricName(metricName)
                .map(kind -> recommend(kind, trend, predictedValue))
                .orElseGet(() -> generic(metricName, trend));
    }

    static String recommend(MetricKind kind, TrendDirection trend, double predictedValue) {
        return switch (kind) {
            case CPU_UTILIZATION -> switch (trend) {
                case INCREASING -> predictedValue > 80
                        ? "Scale up immediately - CPU utilization approaching critical levels"
                        : "Monitor closely - CPU trend increasing";
                case DECREASING -> predictedValue < 30
                        ? "Consider scaling down to optimize costs"
                        : "Current capacity appears sufficient";
                case STABLE -> "Maintain current configuration - metrics are stable";
            };
            case MEMORY_UTILIZATION -> switch (trend) {
                case INCREASING -> predictedValue > 85
                        ? "Increase memory allocation or scale horizontally"
                        : "Monitor memory usage patterns";
                case DECREASING -> predictedValue < 40
                        ? "Consider reducing memory allocation to save costs"
                        : "Memory usage is optimal";
                case STABLE -> "Memory configuration is well-sized for current workload";
            };
            case NETWORK_LATENCY -> switch (trend) {
                case INCREASING -> "Investigate network bottlenecks and consider CDN or edge optimization";
                case DECREASING -> "Network performance is improving - maintain current configuration";
                case STABLE -> "Network performance is consistent";
            };
            case ERROR_RATE -> generic(kind.getMetricName(), trend);
        };
    }

    private static String generic(String metricName, TrendDirection trend) {
        return "Monitor " + metricName + " - trend is " + trend.getLabel();
    }
}
