package com.xammer.insights.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrendSummary {
    int totalMetrics;
    int increasingTrends;
    int decreasingTrends;
    int stableTrends;
    Health overallHealth;

    public enum Health {
        GOOD("good"),
        NEEDS_ATTENTION("needs_attention");

        private final String label;

        Health(String label) {
            this.label = label;
        }

        @JsonValue
        public String getLabel() {
            return label;
        }
    }
}
