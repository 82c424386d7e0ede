package com.gameinsights.anomaly.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdOverridesTest {

    @Test
    void applyTo_partialOverride_keepsOtherFields() {
        DetectionThresholds base = new DetectionThresholds();
        ThresholdOverrides overrides = ThresholdOverrides.builder()
                .highStdDev(3.5)
                .minDataPoints(10)
                .build();

        DetectionThresholds merged = overrides.applyTo(base);

        assertThat(merged.getHighStdDev()).isEqualTo(3.5);
        assertThat(merged.getMinDataPoints()).isEqualTo(10);
        assertThat(merged.getLowStdDev()).isEqualTo(2.0);
        assertThat(merged.getCriticalStdDev()).isEqualTo(4.0);
        assertThat(merged.getMinPercentChange()).isEqualTo(20.0);
    }

    @Test
    void applyTo_doesNotMutateBase() {
        DetectionThresholds base = new DetectionThresholds();

        ThresholdOverrides.builder().lowStdDev(1.0).build().applyTo(base);

        assertThat(base.getLowStdDev()).isEqualTo(2.0);
    }
}
