package com.xammer.insights.dto;

import lombok.Value;

/**
 * Monthly totals across all services, rounded to whole currency units.
 */
@Value
public class CostOptimization {
    long currentMonthlyCost;
    long projectedMonthlyCost;
    long potentialSavings;
}
