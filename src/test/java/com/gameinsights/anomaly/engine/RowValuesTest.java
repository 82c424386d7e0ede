package com.gameinsights.anomaly.engine;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RowValuesTest {

    private static final Instant NEW_YEAR = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void number_numericValue_passesThrough() {
        assertThat(RowValues.number(Map.of("v", 42), "v")).isEqualTo(42.0);
        assertThat(RowValues.number(Map.of("v", 12.5), "v")).isEqualTo(12.5);
    }

    @Test
    void number_stringWithTrailingText_readsLeadingFloat() {
        assertThat(RowValues.number(Map.of("v", "12.5 USD"), "v")).isEqualTo(12.5);
        assertThat(RowValues.number(Map.of("v", " -3e2"), "v")).isEqualTo(-300.0);
    }

    @Test
    void number_unreadable_returnsZero() {
        Map<String, Object> row = new HashMap<>();
        row.put("text", "abc");
        row.put("empty", "");
        row.put("missing", null);
        row.put("flag", true);

        assertThat(RowValues.number(row, "text")).isZero();
        assertThat(RowValues.number(row, "empty")).isZero();
        assertThat(RowValues.number(row, "missing")).isZero();
        assertThat(RowValues.number(row, "flag")).isZero();
        assertThat(RowValues.number(row, "absent")).isZero();
    }

    @Test
    void number_nonFinite_coercedToZero() {
        assertThat(RowValues.number(Map.of("v", Double.NaN), "v")).isZero();
        assertThat(RowValues.number(Map.of("v", Double.POSITIVE_INFINITY), "v")).isZero();
    }

    @Test
    void toInstant_epochSecondsAndMillis_sameInstant() {
        assertThat(RowValues.toInstant(1704067200L)).isEqualTo(NEW_YEAR);
        assertThat(RowValues.toInstant(1704067200000L)).isEqualTo(NEW_YEAR);
    }

    @Test
    void toInstant_zeroOrBlank_isMissing() {
        assertThat(RowValues.toInstant(0)).isNull();
        assertThat(RowValues.toInstant("  ")).isNull();
        assertThat(RowValues.toInstant(null)).isNull();
    }

    @Test
    void toInstant_isoStrings_parsedAsUtc() {
        assertThat(RowValues.toInstant("2024-01-01")).isEqualTo(NEW_YEAR);
        assertThat(RowValues.toInstant("2024-01-01T00:00:00Z")).isEqualTo(NEW_YEAR);
        assertThat(RowValues.toInstant("2024-01-01T02:00:00+02:00")).isEqualTo(NEW_YEAR);
        assertThat(RowValues.toInstant("2024-01-01T00:00:00")).isEqualTo(NEW_YEAR);
        assertThat(RowValues.toInstant("2024-01-01 00:00:00")).isEqualTo(NEW_YEAR);
    }

    @Test
    void toInstant_slashSeparatedDates_parsedAsUtc() {
        assertThat(RowValues.toInstant("2024/01/05")).isEqualTo(Instant.parse("2024-01-05T00:00:00Z"));
        assertThat(RowValues.toInstant("2024/01/05 10:00:00")).isEqualTo(Instant.parse("2024-01-05T10:00:00Z"));
    }

    @Test
    void toInstant_dateObjects_converted() {
        assertThat(RowValues.toInstant(Date.from(NEW_YEAR))).isEqualTo(NEW_YEAR);
        assertThat(RowValues.toInstant(LocalDate.of(2024, 1, 1))).isEqualTo(NEW_YEAR);
        assertThat(RowValues.toInstant(NEW_YEAR)).isEqualTo(NEW_YEAR);
    }

    @Test
    void toInstant_garbage_returnsNull() {
        assertThat(RowValues.toInstant("yesterday-ish")).isNull();
        assertThat(RowValues.toInstant(new Object())).isNull();
    }
}
