package com.xammer.insights.util;

import com.xammer.insights.dto.RegressionResult;
import com.xammer.insights.exception.InsufficientDataException;
import com.xammer.insights.exception.InvalidInputException;

import java.util.List;

/**
 * Numeric primitives shared by every analyzer. All methods are pure.
 */
public final class Statistics {

    public static final double MIN_CONFIDENCE = 0.1;
    public static final double MAX_CONFIDENCE = 0.95;

    private Statistics() {
    }

    /**
     * Copies a boxed series into a primitive array, rejecting nulls.
     */
    public static double[] toArray(List<Double> series) {
        requireNonNull(series, "Series");
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            Double value = series.get(i);
            if (value == null) {
                throw new InvalidInputException("Series contains a null value at index " + i);
            }
            values[i] = value;
        }
        return values;
    }

    public static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new InvalidInputException(name + " must not be null");
        }
        return value;
    }

    /**
     * Rejects a null list as well as any null element in it.
     */
    public static <T> List<T> requireNoNullElements(List<T> values, String name) {
        requireNonNull(values, name);
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new InvalidInputException(name + " contains a null value at index " + i);
            }
        }
        return values;
    }

    public static double mean(double[] data) {
        requireNonEmpty(data);
        double sum = 0;
        for (double v : data) {
            sum += v;
        }
        return sum / data.length;
    }

    /**
     * Population standard deviation.
     */
    public static double stddev(double[] data) {
        double mean = mean(data);
        double squaredDiffs = 0;
        for (double v : data) {
            squaredDiffs += (v - mean) * (v - mean);
        }
        return Math.sqrt(squaredDiffs / data.length);
    }

    /**
     * Noise band a change has to exceed before it counts as real: 10% of the mean or one
     * standard deviation, whichever is smaller.
     */
    public static double dynamicThreshold(double[] data) {
        return Math.min(mean(data) * 0.1, stddev(data));
    }

    public static RegressionResult linearRegression(double[] data) {
        requireNonEmpty(data);
        int n = data.length;

        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += data[i];
            sumXY += i * data[i];
            sumXX += (double) i * i;
        }

        double denominator = n * sumXX - sumX * sumX;
        double slope = denominator == 0 ? 0 : (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;
        double nextValue = slope * n + intercept;

        double yMean = sumY / n;
        double totalSumSquares = 0;
        double residualSumSquares = 0;
        for (int i = 0; i < n; i++) {
            double predicted = slope * i + intercept;
            totalSumSquares += (data[i] - yMean) * (data[i] - yMean);
            residualSumSquares += (data[i] - predicted) * (data[i] - predicted);
        }

        // A series without variance is fitted exactly by the flat line through its mean.
        double rSquared = totalSumSquares == 0 ? 1.0 : 1 - (residualSumSquares / totalSumSquares);

        return new RegressionResult(slope, intercept, Math.max(0, nextValue), clampConfidence(rSquared));
    }

    /**
     * Lag-k autocorrelation: the mean lagged product over the {@code n - lag} overlapping pairs,
     * divided by the population variance, clamped to [-1, 1]. A series that repeats exactly with
     * period {@code lag} scores 1. Returns 0 when the series is not longer than the lag or has
     * no variance.
     */
    public static double autocorrelation(double[] data, int lag) {
        if (data == null || lag < 1 || data.length <= lag) {
            return 0;
        }
        double mean = mean(data);
        int pairs = data.length - lag;

        double covariance = 0;
        for (int i = 0; i < pairs; i++) {
            covariance += (data[i] - mean) * (data[i + lag] - mean);
        }
        double variance = 0;
        for (double v : data) {
            variance += (v - mean) * (v - mean);
        }
        if (variance == 0) {
            return 0;
        }
        double correlation = (covariance / pairs) / (variance / data.length);
        return Math.max(-1, Math.min(1, correlation));
    }

    /**
     * Coefficient of variation capped at 1; 0 when the mean is 0.
     */
    public static double variationStrength(double[] data) {
        double mean = mean(data);
        if (mean == 0) {
            return 0;
        }
        return Math.min(1, stddev(data) / mean);
    }

    /**
     * Value at {@code floor(length * fraction)} of an ascending array, clamped to the last element.
     */
    public static double percentile(double[] sorted, double fraction) {
        requireNonEmpty(sorted);
        int index = (int) Math.floor(sorted.length * fraction);
        return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
    }

    static double clampConfidence(double value) {
        if (Double.isNaN(value)) {
            return MIN_CONFIDENCE;
        }
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, value));
    }

    private static void requireNonEmpty(double[] data) {
        if (data == null || data.length == 0) {
            throw new InsufficientDataException("statistics", data == null ? 0 : data.length, 1);
        }
    }
}
