package com.xammer.insights.service;

import com.xammer.insights.config.AnalyticsProperties;
import com.xammer.insights.dto.PatternType;
import com.xammer.insights.dto.TrendDirection;
import com.xammer.insights.dto.TrendSummary;
import com.xammer.insights.exception.InsufficientDataException;
import com.xammer.insights.exception.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TrendAnalysisServiceTest {

    private final TrendAnalysisService service = trendAnalysisService();

    static TrendAnalysisService trendAnalysisService() {
        var properties = new AnalyticsProperties();
        var clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        return new TrendAnalysisService(properties,
                new SeasonalityDetectionService(clock),
                new AnomalyDetectionService(properties, clock));
    }

    @Test
    void analyzeTrend_detectsIncreasingArithmeticSeries() {
        var result = service.analyzeTrend(List.of(10.0, 20.0, 30.0, 40.0, 50.0, 60.0), "cpu_utilization");

        assertThat(result.getMetricName()).isEqualTo("cpu_utilization");
        assertThat(result.getTrend()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.getCurrentValue()).isEqualTo(60.0);
        assertThat(result.getPredictedValue()).isCloseTo(70.0, within(1e-9));
        assertThat(result.getConfidence()).isCloseTo(0.95, within(1e-9));
        assertThat(result.getTimeToThreshold()).isCloseTo(2.0, within(1e-9));
        assertThat(result.getRecommendedAction()).isEqualTo("Monitor closely - CPU trend increasing");
        assertThat(result.getSeasonalPattern()).isEqualTo(PatternType.NONE);
        // 60 against history mean 30 and stddev sqrt(200)
        assertThat(result.getAnomalyScore()).isCloseTo(30 / Math.sqrt(200) / 3, within(1e-9));
    }

    @Test
    void analyzeTrend_reportsStableConstantSeriesWithoutThreshold() {
        var result = service.analyzeTrend(Collections.nCopies(6, 50.0), "cpu_utilization");

        assertThat(result.getTrend()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.getPredictedValue()).isCloseTo(50.0, within(1e-9));
        assertThat(result.getTimeToThreshold()).isNull();
        assertThat(result.getAnomalyScore()).isZero();
        assertThat(result.getRecommendedAction()).isEqualTo("Maintain current configuration - metrics are stable");
    }

    @Test
    void analyzeTrend_detectsDecreasingSeries() {
        var result = service.analyzeTrend(List.of(60.0, 50.0, 40.0, 30.0, 20.0, 10.0), "cpu_utilization");

        assertThat(result.getTrend()).isEqualTo(TrendDirection.DECREASING);
        assertThat(result.getPredictedValue()).isCloseTo(0.0, within(1e-9));
        assertThat(result.getTimeToThreshold()).isNull();
        assertThat(result.getRecommendedAction()).isEqualTo("Consider scaling down to optimize costs");
    }

    @Test
    void analyzeTrend_ignoresNoiseBelowDynamicThreshold() {
        var result = service.analyzeTrend(List.of(50.0, 51.0, 50.0, 51.0, 50.0, 51.0, 50.0, 51.0, 50.0, 51.0),
                "memory_utilization");

        assertThat(result.getTrend()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.getRecommendedAction()).isEqualTo("Memory configuration is well-sized for current workload");
    }

    @Test
    void analyzeTrend_reportsZeroTimeToThreshold_whenAlreadyCritical() {
        var result = service.analyzeTrend(List.of(76.0, 78.0, 80.0, 82.0, 84.0), "cpu_utilization");

        assertThat(result.getTimeToThreshold()).isZero();
        assertThat(result.getRecommendedAction())
                .isEqualTo("Scale up immediately - CPU utilization approaching critical levels");
    }

    @Test
    void analyzeTrend_fallsBackToGenericRecommendation() {
        var result = service.analyzeTrend(Collections.nCopies(5, 10.0), "disk_io");

        assertThat(result.getRecommendedAction()).isEqualTo("Monitor disk_io - trend is stable");
    }

    @Test
    void analyzeTrend_foldsInDailySeasonality() {
        var series = new ArrayList<Double>();
        for (int i = 0; i < 48; i++) {
            series.add(50 + 30 * Math.sin(2 * Math.PI * (i % 24) / 24));
        }

        var result = service.analyzeTrend(series, "cpu_utilization");

        assertThat(result.getSeasonalPattern()).isEqualTo(PatternType.DAILY);
    }

    @Test
    void analyzeTrend_fails_belowFiveDataPoints() {
        assertThatThrownBy(() -> service.analyzeTrend(List.of(1.0, 2.0, 3.0, 4.0), "cpu_utilization"))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("5 required");
    }

    @Test
    void analyzeTrend_isIdempotent() {
        var series = List.of(12.0, 18.0, 11.0, 25.0, 31.0, 28.0, 40.0);

        assertThat(service.analyzeTrend(series, "cpu_utilization"))
                .isEqualTo(service.analyzeTrend(series, "cpu_utilization"));
    }

    @Test
    void summarizeTrends_isHealthy_whenMostMetricsAreStable() {
        var histories = new LinkedHashMap<String, List<Double>>();
        histories.put("cpu_utilization", List.of(10.0, 20.0, 30.0, 40.0, 50.0, 60.0));
        histories.put("memory_utilization", Collections.nCopies(6, 50.0));
        histories.put("network_latency", Collections.nCopies(6, 20.0));

        var summary = service.summarizeTrends(histories);

        assertThat(summary.getTotalMetrics()).isEqualTo(3);
        assertThat(summary.getIncreasingTrends()).isEqualTo(1);
        assertThat(summary.getStableTrends()).isEqualTo(2);
        assertThat(summary.getOverallHealth()).isEqualTo(TrendSummary.Health.GOOD);
    }

    @Test
    void summarizeTrends_needsAttention_whenMovingMetricsDominate() {
        var histories = new LinkedHashMap<String, List<Double>>();
        histories.put("cpu_utilization", List.of(10.0, 20.0, 30.0, 40.0, 50.0, 60.0));
        histories.put("memory_utilization", List.of(60.0, 50.0, 40.0, 30.0, 20.0, 10.0));
        histories.put("network_latency", Collections.nCopies(6, 20.0));

        var summary = service.summarizeTrends(histories);

        assertThat(summary.getDecreasingTrends()).isEqualTo(1);
        assertThat(summary.getOverallHealth()).isEqualTo(TrendSummary.Health.NEEDS_ATTENTION);
    }


    @Test
    void summarizeTrends_rejectsNullInput() {
        assertThatThrownBy(() -> trendAnalysisService().summarizeTrends(null))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    void analyzeTrend_logsFailureWithStackTrace(CapturedOutput output) {
        assertThatThrownBy(() -> trendAnalysisService().analyzeTrend(List.of(1.0, 2.0), "cpu_utilization"))
                .isInstanceOf(InsufficientDataException.class);

        assertThat(output).contains("Error analyzing capacity trends for cpu_utilization")
                .contains(InsufficientDataException.class.getName());
    }
}
