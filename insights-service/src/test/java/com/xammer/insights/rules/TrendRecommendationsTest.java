package com.xammer.insights.rules;

import com.xammer.insights.dto.TrendDirection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class TrendRecommendationsTest {

    @Test
    void cpu_switchesOnPredictedValue() {
        assertThat(TrendRecommendations.recommend("cpu_utilization", TrendDirection.INCREASING, 81))
                .isEqualTo("Scale up immediately - CPU utilization approaching critical levels");
        assertThat(TrendRecommendations.recommend("cpu_utilization", TrendDirection.INCREASING, 80))
                .isEqualTo("Monitor closely - CPU trend increasing");
        assertThat(TrendRecommendations.recommend("cpu_utilization", TrendDirection.DECREASING, 29))
                .isEqualTo("Consider scaling down to optimize costs");
        assertThat(TrendRecommendations.recommend("cpu_utilization", TrendDirection.DECREASING, 30))
                .isEqualTo("Current capacity appears sufficient");
    }

    @Test
    void memory_usesItsOwnCutoffs() {
        assertThat(TrendRecommendations.recommend("memory_utilization", TrendDirection.INCREASING, 86))
                .isEqualTo("Increase memory allocation or scale horizontally");
        assertThat(TrendRecommendations.recommend("memory_utilization", TrendDirection.INCREASING, 85))
                .isEqualTo("Monitor memory usage patterns");
        assertThat(TrendRecommendations.recommend("memory_utilization", TrendDirection.DECREASING, 39))
                .isEqualTo("Consider reducing memory allocation to save costs");
        assertThat(TrendRecommendations.recommend("memory_utilization", TrendDirection.STABLE, 50))
                .isEqualTo("Memory configuration is well-sized for current workload");
    }

    @Test
    void networkLatency_ignoresPredictedValue() {
        assertThat(TrendRecommendations.recommend("network_latency", TrendDirection.INCREASING, 1))
                .isEqualTo("Investigate network bottlenecks and consider CDN or edge optimization");
        assertThat(TrendRecommendations.recommend("network_latency", TrendDirection.STABLE, 500))
                .isEqualTo("Network performance is consistent");
    }

    @ParameterizedTest
    @EnumSource(TrendDirection.class)
    void errorRateAndUnknownMetrics_fallBackToGenericText(TrendDirection trend) {
        assertThat(TrendRecommendations.recommend("error_rate", trend, 10))
                .isEqualTo("Monitor error_rate - trend is " + trend.getLabel());
        assertThat(TrendRecommendations.recommend("queue_depth", trend, 10))
                .isEqualTo("Monitor queue_depth - trend is " + trend.getLabel());
    }
}
