package com.xammer.insights.service;

import com.xammer.insights.dto.LatencyProfile;
import com.xammer.insights.exception.InsufficientDataException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LatencyAnalysisServiceTest {

    private final LatencyAnalysisService service = new LatencyAnalysisService();

    @Test
    void profile_computesAverageAndTailLatency_fromUnsortedSamples() {
        List<Double> latencies = new ArrayList<>();
        for (int i = 1; i <= 100; i++) {
            latencies.add((double) i);
        }
        Collections.shuffle(latencies, new Random(7));
        List<Double> snapshot = List.copyOf(latencies);

        LatencyProfile profile = service.profile(latencies);

        assertThat(profile.getAverageLatency()).isCloseTo(50.5, within(1e-9));
        assertThat(profile.getP95Latency()).isEqualTo(96.0);
        assertThat(profile.getP99Latency()).isEqualTo(100.0);
        assertThat(profile.getEfficiency()).isCloseTo(0.495, within(1e-9));
        assertThat(latencies).as("input is not reordered").isEqualTo(snapshot);
    }

    @Test
    void profile_floorsEfficiencyAtZero_forSlowServices() {
        LatencyProfile profile = service.profile(List.of(150.0, 150.0, 150.0));

        assertThat(profile.getAverageLatency()).isEqualTo(150.0);
        assertThat(profile.getP95Latency()).isEqualTo(150.0);
        assertThat(profile.getEfficiency()).isZero();
    }

    @Test
    void profile_rejectsEmptyInput() {
        assertThatThrownBy(() -> service.profile(List.of()))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("latency analysis");
    }
}
