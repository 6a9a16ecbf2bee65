package com.xammer.insights.service;

import com.xammer.insights.dto.LatencyProfile;
import com.xammer.insights.exception.InsufficientDataException;
import com.xammer.insights.util.Statistics;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Average and tail latency over a batch of samples in milliseconds.
 */
@Service
public class LatencyAnalysisService {

    private static final double EFFICIENCY_CEILING_MS = 100;

    public LatencyProfile profile(List<Double> latencies) {
        double[] sorted = Statistics.toArray(latencies);
        if (sorted.length == 0) {
            throw new InsufficientDataException("latency analysis", 0, 1);
        }
        Arrays.sort(sorted);

        double average = Statistics.mean(sorted);
        return LatencyProfile.builder()
                .averageLatency(average)
                .p95Latency(Statistics.percentile(sorted, 0.95))
                .p99Latency(Statistics.percentile(sorted, 0.99))
                .efficiency(Math.max(0, 1 - average / EFFICIENCY_CEILING_MS))
                .build();
    }
}
