package com.gameinsights.anomaly.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityTest {

    private final DetectionThresholds thresholds = new DetectionThresholds();

    @Test
    void fromZScore_atEachThreshold_returnsThatTier() {
        assertThat(Severity.fromZScore(2.0, thresholds)).isEqualTo(Severity.LOW);
        assertThat(Severity.fromZScore(2.5, thresholds)).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.fromZScore(3.0, thresholds)).isEqualTo(Severity.HIGH);
        assertThat(Severity.fromZScore(4.0, thresholds)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void fromZScore_negativeZ_usesMagnitude() {
        assertThat(Severity.fromZScore(-4.2, thresholds)).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.fromZScore(-2.6, thresholds)).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void fromZScore_growingMagnitude_neverLowersSeverity() {
        List<Severity> tiers = new ArrayList<>();
        for (double z = 2.0; z <= 6.0; z += 0.1) {
            tiers.add(Severity.fromZScore(z, thresholds));
        }
        for (int i = 1; i < tiers.size(); i++) {
            assertThat(tiers.get(i).ordinal()).isGreaterThanOrEqualTo(tiers.get(i - 1).ordinal());
        }
    }

    @Test
    void fromZScore_customThresholds_applied() {
        DetectionThresholds strict = DetectionThresholds.builder()
                .lowStdDev(1.0).mediumStdDev(1.5).highStdDev(2.0).criticalStdDev(2.2)
                .build();

        assertThat(Severity.fromZScore(2.3, strict)).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.fromZScore(2.3, thresholds)).isEqualTo(Severity.LOW);
    }

    @Test
    void rank_criticalSortsFirst() {
        assertThat(Severity.CRITICAL.rank()).isLessThan(Severity.HIGH.rank());
        assertThat(Severity.HIGH.rank()).isLessThan(Severity.MEDIUM.rank());
        assertThat(Severity.MEDIUM.rank()).isLessThan(Severity.LOW.rank());
    }
}
