package com.xammer.insights.dto;

import lombok.Value;

/**
 * Ordinary least squares fit of a series against its index positions.
 */
@Value
public class RegressionResult {
    double slope;
    double intercept;
    double nextValue;   // forecast for index n, never negative
    double confidence;  // R-squared clamped to [0.1, 0.95]
}
