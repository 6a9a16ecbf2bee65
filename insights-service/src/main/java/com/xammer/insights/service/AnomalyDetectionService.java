package com.xammer.insights.service;

import com.xammer.insights.config.AnalyticsProperties;
import com.xammer.insights.dto.AnomalyAlert;
import com.xammer.insights.dto.AnomalyRecord;
import com.xammer.insights.dto.AnomalyReport;
import com.xammer.insights.dto.AnomalySummary;
import com.xammer.insights.dto.ExpectedRange;
import com.xammer.insights.dto.Severity;
import com.xammer.insights.rules.AnomalyPlaybook;
import com.xammer.insights.util.Numbers;
import com.xammer.insights.util.Statistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Flags readings that fall outside the range their own history predicts.
 */
@Service
@Slf4j
public class AnomalyDetectionService {

    static final int MIN_HISTORY = 10;

    private final AnalyticsProperties properties;
    private final Clock clock;

    public AnomalyDetectionService(AnalyticsProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Scores the last value of a series against everything before it: |z| / 3 capped at 1.
     * Series shorter than 3, or with a flat history, score 0.
     */
    public double score(double[] series) {
        if (series == null || series.length < 3) {
            return 0;
        }
        double recent = series[series.length - 1];
        double[] historical = Arrays.copyOf(series, series.length - 1);
        double stdDev = Statistics.stddev(historical);
        if (stdDev == 0) {
            return 0;
        }
        double zScore = Math.abs(recent - Statistics.mean(historical)) / stdDev;
        return Math.min(1, zScore / 3);
    }

    public double score(List<Double> series) {
        return score(Statistics.toArray(series));
    }

    /**
     * Checks each current reading against its history. Metrics without at least
     * {@value #MIN_HISTORY} historical samples are skipped.
     */
    public List<AnomalyRecord> detectAnomalies(Map<String, Double> currentMetrics,
                                               Map<String, List<Double>> historicalData) {
        try {
            Statistics.requireNonNull(currentMetrics, "Current metrics");
            Statistics.requireNonNull(historicalData, "Historical data");
            log.info("Detecting anomalies in {} current metrics", currentMetrics.size());
            List<AnomalyRecord> anomalies = new ArrayList<>();

            for (Map.Entry<String, Double> entry : currentMetrics.entrySet()) {
                String metric = entry.getKey();
                Double currentValue = entry.getValue();
                List<Double> historical = historicalData.get(metric);
                if (currentValue == null || historical == null || historical.size() < MIN_HISTORY) {
                    log.debug("Skipping {} - not enough history", metric);
                    continue;
                }

                double[] history = Statistics.toArray(historical);
                ExpectedRange expectedRange = expectedRange(history);
                double anomalyScore = metricAnomalyScore(currentValue, history);

                if (anomalyScore > properties.getAnomalyReportThreshold()) {
                    Severity severity = severity(anomalyScore, metric);
                    anomalies.add(AnomalyRecord.builder()
                            .metric(metric)
                            .value(currentValue)
                            .expectedRange(expectedRange)
                            .anomalyScore(anomalyScore)
                            .severity(severity)
                            .possibleCauses(AnomalyPlaybook.possibleCauses(metric, currentValue > expectedRange.getMax()))
                            .recommendedActions(AnomalyPlaybook.recommendedActions(metric, severity))
                            .build());
                }
            }

            log.info("Detected {} anomalies", anomalies.size());
            return anomalies;
        } catch (RuntimeException e) {
            log.error("Error detecting anomalies", e);
            throw e;
        }
    }

    /**
     * Runs detection and adds the severity breakdown plus an alert for every high or critical finding.
     */
    public AnomalyReport buildReport(Map<String, Double> currentMetrics, Map<String, List<Double>> historicalData) {
        List<AnomalyRecord> anomalies = detectAnomalies(currentMetrics, historicalData);

        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        anomalies.forEach(anomaly -> counts.merge(anomaly.getSeverity(), 1, Integer::sum));

        Instant now = clock.instant();
        List<AnomalyAlert> alerts = new ArrayList<>();
        for (AnomalyRecord anomaly : anomalies) {
            if (anomaly.getSeverity().isAlerting()) {
                alerts.add(AnomalyAlert.builder()
                        .id("alert-" + now.toEpochMilli() + "-" + anomaly.getMetric())
                        .severity(anomaly.getSeverity())
                        .metric(anomaly.getMetric())
                        .message(anomaly.getMetric() + " anomaly detected: " + Numbers.display(anomaly.getValue())
                                + " (expected: " + Numbers.display(anomaly.getExpectedRange().getMin())
                                + "-" + Numbers.display(anomaly.getExpectedRange().getMax()) + ")")
                        .actions(anomaly.getRecommendedActions())
                        .timestamp(now)
                        .build());
            }
        }

        return AnomalyReport.builder()
                .anomalies(anomalies)
                .summary(AnomalySummary.builder()
                        .total(anomalies.size())
                        .critical(counts.getOrDefault(Severity.CRITICAL, 0))
                        .high(counts.getOrDefault(Severity.HIGH, 0))
                        .medium(counts.getOrDefault(Severity.MEDIUM, 0))
                        .low(counts.getOrDefault(Severity.LOW, 0))
                        .build())
                .alerts(alerts)
                .build();
    }

    ExpectedRange expectedRange(double[] historical) {
        double mean = Statistics.mean(historical);
        double stdDev = Statistics.stddev(historical);
        return new ExpectedRange(mean - 2 * stdDev, mean + 2 * stdDev);
    }

    double metricAnomalyScore(double currentValue, double[] historical) {
        if (expectedRange(historical).contains(currentValue)) {
            return 0;
        }
        double mean = Statistics.mean(historical);
        double stdDev = Statistics.stddev(historical);
        if (stdDev == 0) {
            return currentValue == mean ? 0 : 1;
        }
        double zScore = Math.abs(currentValue - mean) / stdDev;
        return Math.min(1, zScore / 4);
    }

    Severity severity(double anomalyScore, String metric) {
        boolean critical = properties.isCriticalMetric(metric);
        if (anomalyScore >= 0.9) {
            return Severity.CRITICAL;
        }
        if (anomalyScore >= 0.8) {
            return critical ? Severity.CRITICAL : Severity.HIGH;
        }
        if (anomalyScore >= 0.7) {
            return critical ? Severity.HIGH : Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
