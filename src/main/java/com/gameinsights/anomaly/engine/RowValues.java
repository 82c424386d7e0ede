package com.gameinsights.anomaly.engine;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient readers for loosely typed row values. Neither method throws: an unreadable
 * timestamp comes back as null and an unreadable number as 0.
 */
public final class RowValues {

    // Values up to this are epoch seconds, above it epoch millis.
    private static final double EPOCH_SECONDS_LIMIT = 1e12;
    // Largest representable date offset in millis (±100,000,000 days).
    private static final double MAX_EPOCH_MILLIS = 8.64e15;

    private static final Pattern LEADING_FLOAT =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    // Tried in order; local date-times without an offset are read as UTC.
    private static final List<Function<String, Instant>> STRING_PARSERS = List.of(
            s -> OffsetDateTime.parse(s).toInstant(),
            localDateTime(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            localDateTime(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")),
            localDateTime(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")),
            localDateTime(DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss")),
            s -> LocalDate.parse(s, DateTimeFormatter.ofPattern("yyyy/MM/dd")).atStartOfDay(ZoneOffset.UTC).toInstant(),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant());

    private RowValues() {}

    /**
     * Numeric value of a column. Numbers pass through, strings are read up to the first
     * character that cannot continue a float ("12.5 USD" is 12.5), everything else is 0.
     */
    public static double number(Map<String, Object> row, String column) {
        Object value = row.get(column);
        double result = 0.0;
        if (value instanceof Number n) {
            result = n.doubleValue();
        } else if (value instanceof String s) {
            Matcher m = LEADING_FLOAT.matcher(s);
            if (m.find()) {
                try {
                    result = Double.parseDouble(m.group(1));
                } catch (NumberFormatException e) {
                    result = 0.0;
                }
            }
        }
        return Double.isFinite(result) ? result : 0.0;
    }

    public static Instant timestamp(Map<String, Object> row, String column) {
        return toInstant(row.get(column));
    }

    /**
     * Reads a timestamp from a date object, an epoch number or an ISO-style string.
     * Empty values (null, 0, blank) count as missing.
     *
     * @return the instant, or null when the value is missing or unreadable
     */
    public static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant i) return i;
        if (value instanceof Date d) return d.toInstant();
        if (value instanceof OffsetDateTime odt) return odt.toInstant();
        if (value instanceof ZonedDateTime zdt) return zdt.toInstant();
        if (value instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
        if (value instanceof LocalDate ld) return ld.atStartOfDay(ZoneOffset.UTC).toInstant();
        if (value instanceof Number n) {
            return fromEpoch(n.doubleValue());
        }
        if (value instanceof String s) {
            return parseString(s.trim());
        }
        return null;
    }

    private static Instant fromEpoch(double epoch) {
        if (epoch == 0 || !Double.isFinite(epoch)) {
            return null;
        }
        double millis = epoch > EPOCH_SECONDS_LIMIT ? epoch : epoch * 1000.0;
        if (Math.abs(millis) > MAX_EPOCH_MILLIS) {
            return null;
        }
        return Instant.ofEpochMilli((long) millis);
    }

    private static Instant parseString(String s) {
        if (s.isEmpty()) {
            return null;
        }
        for (Function<String, Instant> parser : STRING_PARSERS) {
            Instant parsed = attempt(parser, s);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static Instant attempt(Function<String, Instant> parser, String s) {
        try {
            return parser.apply(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Function<String, Instant> localDateTime(DateTimeFormatter format) {
        return s -> LocalDateTime.parse(s, format).toInstant(ZoneOffset.UTC);
    }
}
