package com.xammer.insights.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyticsPropertiesTest {

    private final AnalyticsProperties properties = new AnalyticsProperties();

    @Test
    void defaults_matchProductionPolicy() {
        assertThat(properties.getCriticalThreshold()).isEqualTo(80);
        assertThat(properties.getTargetUtilization()).isEqualTo(70);
        assertThat(properties.getScaleDownConfidence()).isEqualTo(0.7);
        assertThat(properties.getAnomalyReportThreshold()).isEqualTo(0.7);
        assertThat(properties.getServices())
                .containsOnlyKeys("ecs-service", "rds-instance", "elasticache-cluster", "lambda-function");
    }

    @Test
    void catalogLookups_fallBackToDefaults() {
        assertThat(properties.capacityOf("ecs-service")).isEqualTo(2);
        assertThat(properties.unitCostOf("rds-instance")).isEqualTo(100);
        assertThat(properties.unitCostOf("elasticache-cluster")).isEqualTo(75);
        assertThat(properties.capacityOf("lambda-function")).isEqualTo(100);
        assertThat(properties.capacityOf("batch-worker")).isEqualTo(1);
        assertThat(properties.unitCostOf("batch-worker")).isEqualTo(50);
    }

    @Test
    void criticalMetrics_areCpuMemoryAndErrorRate() {
        assertThat(properties.isCriticalMetric("cpu_utilization")).isTrue();
        assertThat(properties.isCriticalMetric("error_rate")).isTrue();
        assertThat(properties.isCriticalMetric("network_latency")).isFalse();
    }
}
