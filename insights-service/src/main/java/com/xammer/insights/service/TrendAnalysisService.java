package com.xammer.insights.service;

import com.xammer.insights.config.AnalyticsProperties;
import com.xammer.insights.dto.PatternType;
import com.xammer.insights.dto.RegressionResult;
import com.xammer.insights.dto.TrendDirection;
import com.xammer.insights.dto.TrendResult;
import com.xammer.insights.dto.TrendSummary;
import com.xammer.insights.exception.InsufficientDataException;
import com.xammer.insights.rules.TrendRecommendations;
import com.xammer.insights.util.Statistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies the direction of a utilization series and forecasts its next value.
 */
@Service
@Slf4j
public class TrendAnalysisService {

    static final int MIN_DATA_POINTS = 5;
    private static final int MAX_WINDOW = 5;

    private final AnalyticsProperties properties;
    private final SeasonalityDetectionService seasonalityDetectionService;
    private final AnomalyDetectionService anomalyDetectionService;

    public TrendAnalysisService(AnalyticsProperties properties,
                                SeasonalityDetectionService seasonalityDetectionService,
                                AnomalyDetectionService anomalyDetectionService) {
        this.properties = properties;
        this.seasonalityDetectionService = seasonalityDetectionService;
        this.anomalyDetectionService = anomalyDetectionService;
    }

    public TrendResult analyzeTrend(List<Double> metricHistory, String metricName) {
        log.info("Analyzing capacity trends for {}", metricName);
        try {
            double[] series = Statistics.toArray(metricHistory);
            if (series.length < MIN_DATA_POINTS) {
                throw new InsufficientDataException("trend analysis", series.length, MIN_DATA_POINTS);
            }

            TrendDirection trend = classify(series);
            RegressionResult regression = Statistics.linearRegression(series);
            double currentValue = series[series.length - 1];

            TrendResult result = TrendResult.builder()
                    .metricName(metricName)
                    .currentValue(currentValue)
                    .predictedValue(regression.getNextValue())
                    .trend(trend)
                    .confidence(regression.getConfidence())
                    .recommendedAction(TrendRecommendations.recommend(metricName, trend, regression.getNextValue()))
                    .timeToThreshold(timeToThreshold(currentValue, regression.getSlope()))
                    .seasonalPattern(seasonalPattern(series))
                    .anomalyScore(anomalyDetectionService.score(series))
                    .build();

            log.info("Trend analysis completed: {} trend with {}% confidence",
                    trend, String.format("%.1f", regression.getConfidence() * 100));
            return result;
        } catch (RuntimeException e) {
            log.error("Error analyzing capacity trends for {}", metricName, e);
            throw e;
        }
    }

    /**
     * Counts trend directions over several metrics. Health is good when stable metrics outnumber
     * the moving ones.
     */
    public TrendSummary summarizeTrends(Map<String, List<Double>> metricHistories) {
        try {
            Statistics.requireNonNull(metricHistories, "Metric histories");
            Map<TrendDirection, Integer> counts = new EnumMap<>(TrendDirection.class);
            metricHistories.forEach((metric, history) ->
                    counts.merge(analyzeTrend(history, metric).getTrend(), 1, Integer::sum));

            int increasing = counts.getOrDefault(TrendDirection.INCREASING, 0);
            int decreasing = counts.getOrDefault(TrendDirection.DECREASING, 0);
            int stable = counts.getOrDefault(TrendDirection.STABLE, 0);

            return TrendSummary.builder()
                    .totalMetrics(metricHistories.size())
                    .increasingTrends(increasing)
                    .decreasingTrends(decreasing)
                    .stableTrends(stable)
                    .overallHealth(stable > increasing + decreasing
                            ? TrendSummary.Health.GOOD
                            : TrendSummary.Health.NEEDS_ATTENTION)
                    .build();
        } catch (RuntimeException e) {
            log.error("Error summarizing trends", e);
            throw e;
        }
    }

    /**
     * Compares the mean of the latest window with the window before it. The difference has to
     * exceed the series' dynamic threshold to count as a trend.
     */
    TrendDirection classify(double[] series) {
        int windowSize = Math.min(MAX_WINDOW, series.length / 2);
        if (windowSize == 0) {
            return TrendDirection.STABLE;
        }
        double[] recent = Arrays.copyOfRange(series, series.length - windowSize, series.length);
        double[] older = Arrays.copyOfRange(series, series.length - 2 * windowSize, series.length - windowSize);

        double recentAvg = Statistics.mean(recent);
        double olderAvg = Statistics.mean(older);
        double threshold = Statistics.dynamicThreshold(series);

        if (recentAvg > olderAvg + threshold) {
            return TrendDirection.INCREASING;
        }
        if (recentAvg < olderAvg - threshold) {
            return TrendDirection.DECREASING;
        }
        return TrendDirection.STABLE;
    }

    Double timeToThreshold(double currentValue, double slope) {
        if (slope <= 0) {
            return null;
        }
        double threshold = properties.getCriticalThreshold();
        if (currentValue >= threshold) {
            return 0.0;
        }
        return Math.max(0, (threshold - currentValue) / slope);
    }

    private PatternType seasonalPattern(double[] series) {
        if (series.length < SeasonalityDetectionService.DAILY_LAG) {
            return PatternType.NONE;
        }
        return seasonalityDetectionService.detectSeasonalPattern(series).getPattern();
    }
}
