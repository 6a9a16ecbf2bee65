package com.xammer.insights.service;

import com.xammer.insights.config.AnalyticsProperties;
import com.xammer.insights.dto.CapacityPrediction;
import com.xammer.insights.dto.CostImpact;
import com.xammer.insights.dto.ScalingAction;
import com.xammer.insights.dto.ScalingRecommendation;
import com.xammer.insights.dto.TrendResult;
import com.xammer.insights.util.Statistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns per-service demand trends into scaling recommendations and monthly cost impact.
 */
@Service
@Slf4j
public class CapacityPredictionService {

    private final AnalyticsProperties properties;
    private final TrendAnalysisService trendAnalysisService;

    public CapacityPredictionService(AnalyticsProperties properties, TrendAnalysisService trendAnalysisService) {
        this.properties = properties;
        this.trendAnalysisService = trendAnalysisService;
    }

    public List<CapacityPrediction> predictCapacityNeeds(Map<String, List<Double>> serviceMetrics) {
        try {
            Statistics.requireNonNull(serviceMetrics, "Service metrics");
            log.info("Predicting capacity needs for {} services", serviceMetrics.size());
            List<CapacityPrediction> predictions = new ArrayList<>();

            for (Map.Entry<String, List<Double>> entry : serviceMetrics.entrySet()) {
                String service = entry.getKey();
                TrendResult trend = trendAnalysisService.analyzeTrend(entry.getValue(), service);
                int currentCapacity = properties.capacityOf(service);

                predictions.add(CapacityPrediction.builder()
                        .service(service)
                        .currentCapacity(currentCapacity)
                        .predictedDemand(trend.getPredictedValue())
                        .recommendedScaling(scalingRecommendation(trend, currentCapacity))
                        .costImpact(costImpact(service, trend.getPredictedValue(), currentCapacity))
                        .build());
            }

            log.info("Generated capacity predictions for {} services", predictions.size());
            return predictions;
        } catch (RuntimeException e) {
            log.error("Error predicting capacity needs", e);
            throw e;
        }
    }

    int requiredCapacity(double predictedDemand) {
        return (int) Math.ceil(predictedDemand / properties.getTargetUtilization());
    }

    CostImpact costImpact(String service, double predictedDemand, int currentCapacity) {
        double unitCost = properties.unitCostOf(service);
        double currentCost = currentCapacity * unitCost;
        double predictedCost = requiredCapacity(predictedDemand) * unitCost;

        return CostImpact.builder()
                .currentCost(currentCost)
                .predictedCost(predictedCost)
                .savings(currentCost > predictedCost ? currentCost - predictedCost : null)
                .build();
    }

    /**
     * Shrinking is only recommended with a confident forecast, so noisy series do not make
     * capacity flap.
     */
    ScalingRecommendation scalingRecommendation(TrendResult trend, int currentCapacity) {
        int requiredCapacity = requiredCapacity(trend.getPredictedValue());

        ScalingAction action = ScalingAction.MAINTAIN;
        int targetCapacity = currentCapacity;
        if (requiredCapacity > currentCapacity) {
            action = ScalingAction.SCALE_UP;
            targetCapacity = requiredCapacity;
        } else if (requiredCapacity < currentCapacity && trend.getConfidence() > properties.getScaleDownConfidence()) {
            action = ScalingAction.SCALE_DOWN;
            targetCapacity = requiredCapacity;
        }

        return ScalingRecommendation.builder()
                .action(action)
                .targetCapacity(targetCapacity)
                .timeframe(timeframe(trend.getTimeToThreshold()))
                .confidence(trend.getConfidence())
                .build();
    }

    private static String timeframe(Double timeToThreshold) {
        if (timeToThreshold == null || timeToThreshold <= 0) {
            return "immediate";
        }
        return (long) Math.ceil(timeToThreshold) + " time units";
    }
}
