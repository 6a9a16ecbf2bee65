package com.xammer.insights.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Engine-wide policy constants and the static service catalog. The defaults below are the
 * production values; {@code application.yml} repeats them so they can be tuned per environment.
 */
@Data
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    /** Utilization percentage treated as critical by trend and capacity policies. */
    private double criticalThreshold = 80;

    /** Utilization percentage each capacity unit is sized for. */
    private double targetUtilization = 70;

    /** Scale-down is only recommended above this forecast confidence. */
    private double scaleDownConfidence = 0.7;

    /** Anomalies are only reported above this score. */
    private double anomalyReportThreshold = 0.7;

    private Set<String> criticalMetrics = new LinkedHashSet<>(Set.of("cpu_utilization", "memory_utilization", "error_rate"));

    private int defaultCapacity = 1;

    private double defaultUnitCost = 50;

    private Map<String, ServiceProfile> services = defaultServices();

    public int capacityOf(String service) {
        ServiceProfile profile = services.get(service);
        return profile != null ? profile.getCapacity() : defaultCapacity;
    }

    public double unitCostOf(String service) {
        ServiceProfile profile = services.get(service);
        return profile != null ? profile.getUnitCost() : defaultUnitCost;
    }

    public boolean isCriticalMetric(String metric) {
        return criticalMetrics.contains(metric);
    }

    private static Map<String, ServiceProfile> defaultServices() {
        Map<String, ServiceProfile> services = new LinkedHashMap<>();
        services.put("ecs-service", new ServiceProfile(2, 50));            // per task
        services.put("rds-instance", new ServiceProfile(1, 100));          // per instance
        services.put("elasticache-cluster", new ServiceProfile(1, 75));    // per node
        services.put("lambda-function", new ServiceProfile(100, 0.0001));  // per request
        return services;
    }

    /**
     * Provisioned units and the monthly cost of one unit.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ServiceProfile {
        private int capacity;
        private double unitCost;
    }
}
