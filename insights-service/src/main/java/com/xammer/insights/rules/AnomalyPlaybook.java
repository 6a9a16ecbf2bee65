package com.xammer.insights.rules;

import com.xammer.insights.dto.Severity;

import java.util.List;

/**
 * Likely causes and follow-up actions for an anomalous metric reading.
 */
public final class AnomalyPlaybook {

    static final List<String> UNKNOWN_CAUSES = List.of("Unknown cause - requires investigation");
    static final List<String> GENERIC_ACTIONS = List.of("Investigate anomaly", "Monitor closely", "Review system logs");

    private AnomalyPlaybook() {
    }

    /**
     * @param aboveRange true when the reading exceeded the expected range, false when it fell below
     */
    public static List<String> possibleCauses(String metricName, boolean aboveRange) {
        return MetricKind.fromMetricName(metricName)
                .map(kind -> possibleCauses(kind, aboveRange))
                .orElse(UNKNOWN_CAUSES);
    }

    public static List<String> recommendedActions(String metricName, Severity severity) {
        return MetricKind.fromMetricName(metricName)
                .map(kind -> recommendedActions(kind, severity))
                .orElse(GENERIC_ACTIONS);
    }

    static List<String> possibleCauses(MetricKind kind, boolean aboveRange) {
        return switch (kind) {
            case CPU_UTILIZATION -> aboveRange
                    ? List.of("High traffic load", "Inefficient algorithms", "Resource contention",
                            "Memory leaks causing CPU spikes")
                    : List.of("Reduced traffic", "Performance optimizations", "Caching improvements");
            case MEMORY_UTILIZATION -> aboveRange
                    ? List.of("Memory leaks", "Large dataset processing", "Inefficient caching",
                            "Increased concurrent users")
                    : List.of("Memory optimization", "Reduced data processing", "Garbage collection improvements");
            case NETWORK_LATENCY -> aboveRange
                    ? List.of("Network congestion", "DNS resolution issues", "Database query slowdowns",
                            "Third-party API delays")
                    : List.of("Network optimization", "CDN improvements", "Database query optimization");
            case ERROR_RATE -> aboveRange
                    ? List.of("Application bugs", "Database connectivity issues", "Third-party service failures",
                            "Configuration errors")
                    : List.of("Bug fixes deployed", "Improved error handling", "Infrastructure stability improvements");
        };
    }

    static List<String> recommendedActions(MetricKind kind, Severity severity) {
        return switch (kind) {
            case CPU_UTILIZATION -> switch (severity) {
                case CRITICAL -> List.of("Scale up immediately", "Investigate CPU-intensive processes",
                        "Enable auto-scaling", "Alert on-call team");
                case HIGH -> List.of("Monitor closely", "Prepare for scaling", "Review recent deployments");
                case MEDIUM -> List.of("Schedule performance review", "Monitor trends");
                case LOW -> List.of("Log for analysis", "Continue monitoring");
            };
            case MEMORY_UTILIZATION -> switch (severity) {
                case CRITICAL -> List.of("Scale up memory", "Investigate memory leaks",
                        "Restart services if necessary", "Alert development team");
                case HIGH -> List.of("Monitor memory patterns", "Review memory allocation", "Check for memory leaks");
                case MEDIUM -> List.of("Schedule memory optimization review", "Monitor garbage collection");
                case LOW -> List.of("Continue monitoring", "Log for trend analysis");
            };
            case ERROR_RATE -> switch (severity) {
                case CRITICAL -> List.of("Immediate investigation required", "Check application logs",
                        "Verify database connectivity", "Alert development team");
                case HIGH -> List.of("Review recent deployments", "Check error logs", "Monitor user impact");
                case MEDIUM -> List.of("Schedule error analysis", "Review error patterns");
                case LOW -> List.of("Log for analysis", "Monitor trends");
            };
            case NETWORK_LATENCY -> GENERIC_ACTIONS;
        };
    }
}
