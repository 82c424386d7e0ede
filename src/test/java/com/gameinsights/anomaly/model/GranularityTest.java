package com.gameinsights.anomaly.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GranularityTest {

    @Test
    void periodKey_hour_truncatesToHour() {
        assertThat(Granularity.HOUR.periodKey(Instant.parse("2024-01-01T10:45:12Z")))
                .isEqualTo("2024-01-01T10:00");
    }

    @Test
    void periodKey_day_usesUtcDate() {
        assertThat(Granularity.DAY.periodKey(Instant.parse("2024-01-01T23:59:59Z")))
                .isEqualTo("2024-01-01");
    }

    @Test
    void periodKey_week_startsOnSunday() {
        // Wednesday
        assertThat(Granularity.WEEK.periodKey(Instant.parse("2024-01-03T12:00:00Z")))
                .isEqualTo("2023-12-31");
        // Sunday maps to itself
        assertThat(Granularity.WEEK.periodKey(Instant.parse("2024-01-07T00:00:00Z")))
                .isEqualTo("2024-01-07");
        // Saturday still belongs to the previous Sunday
        assertThat(Granularity.WEEK.periodKey(Instant.parse("2024-01-13T23:00:00Z")))
                .isEqualTo("2024-01-07");
    }

    @Test
    void periodKey_keysSortChronologically() {
        String earlier = Granularity.HOUR.periodKey(Instant.parse("2024-01-01T09:00:00Z"));
        String later = Granularity.HOUR.periodKey(Instant.parse("2024-01-01T10:00:00Z"));

        assertThat(earlier).isLessThan(later);
    }
}
