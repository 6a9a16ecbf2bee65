package com.xammer.insights.service;

import com.xammer.insights.dto.ActionPriority;
import com.xammer.insights.dto.CapacityPlan;
import com.xammer.insights.dto.CapacityPrediction;
import com.xammer.insights.dto.CostOptimization;
import com.xammer.insights.dto.PlannedScalingAction;
import com.xammer.insights.dto.ScalingAction;
import com.xammer.insights.dto.ScalingRecommendation;
import com.xammer.insights.util.Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rolls per-service capacity predictions up into a plan: cost totals, prioritized scaling
 * actions and plain-language recommendations.
 */
@Service
public class CapacityPlanningService {

    private static final Logger logger = LoggerFactory.getLogger(CapacityPlanningService.class);

    private final CapacityPredictionService capacityPredictionService;

    public CapacityPlanningService(CapacityPredictionService capacityPredictionService) {
        this.capacityPredictionService = capacityPredictionService;
    }

    public CapacityPlan buildPlan(Map<String, List<Double>> serviceMetrics) {
        List<CapacityPrediction> predictions = capacityPredictionService.predictCapacityNeeds(serviceMetrics);
        CostOptimization costOptimization = costOptimization(predictions);

        logger.info("Capacity plan for {} services: current ${}/month, projected ${}/month",
                predictions.size(), costOptimization.getCurrentMonthlyCost(), costOptimization.getProjectedMonthlyCost());

        return CapacityPlan.builder()
                .predictions(predictions)
                .costOptimization(costOptimization)
                .scalingActions(scalingActions(predictions))
                .recommendations(recommendations(predictions))
                .build();
    }

    CostOptimization costOptimization(List<CapacityPrediction> predictions) {
        double current = predictions.stream().mapToDouble(p -> p.getCostImpact().getCurrentCost()).sum();
        double projected = predictions.stream().mapToDouble(p -> p.getCostImpact().getPredictedCost()).sum();
        double savings = Math.max(0, current - projected);
        return new CostOptimization(Math.round(current), Math.round(projected), Math.round(savings));
    }

    List<PlannedScalingAction> scalingActions(List<CapacityPrediction> predictions) {
        return predictions.stream()
                .filter(p -> p.getRecommendedScaling().getAction() != ScalingAction.MAINTAIN)
                .map(p -> {
                    ScalingRecommendation scaling = p.getRecommendedScaling();
                    return PlannedScalingAction.builder()
                            .service(p.getService())
                            .action(scaling.getAction())
                            .timeframe(scaling.getTimeframe())
                            .priority(priority(scaling.getConfidence(), p.getPredictedDemand()))
                            .build();
                })
                .collect(Collectors.toList());
    }

    static ActionPriority priority(double confidence, double demand) {
        if (confidence > 0.8 && demand > 80) {
            return ActionPriority.HIGH;
        }
        if (confidence > 0.6 && demand > 60) {
            return ActionPriority.MEDIUM;
        }
        return ActionPriority.LOW;
    }

    List<String> recommendations(List<CapacityPrediction> predictions) {
        List<String> recommendations = new ArrayList<>();
        for (CapacityPrediction p : predictions) {
            switch (p.getRecommendedScaling().getAction()) {
                case SCALE_UP:
                    recommendations.add("Scale up " + p.getService() + " to handle predicted "
                            + Numbers.display(p.getPredictedDemand()) + "% demand");
                    break;
                case SCALE_DOWN:
                    recommendations.add("Consider scaling down " + p.getService() + " to optimize costs");
                    break;
                default:
                    break;
            }
        }
        if (recommendations.isEmpty()) {
            recommendations.add("All services are optimally configured");
        }
        return recommendations;
    }
}
