package com.gameinsights.anomaly.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Width of a time bucket. Period keys are derived in UTC and sort
 * lexicographically in chronological order.
 */
public enum Granularity {
    HOUR,
    DAY,
    WEEK;

    private static final DateTimeFormatter HOUR_KEY = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:00");

    public String periodKey(Instant instant) {
        LocalDateTime utc = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        switch (this) {
            case HOUR:
                return utc.truncatedTo(ChronoUnit.HOURS).format(HOUR_KEY);
            case WEEK:
                LocalDate sunday = utc.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
                return sunday.toString();
            case DAY:
            default:
                return utc.toLocalDate().toString();
        }
    }
}
