package com.xammer.insights.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Monthly cost of the current capacity against the capacity sized for predicted demand.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CostImpact {
    double currentCost;
    double predictedCost;
    Double savings;   // only set when the predicted cost is lower
}
