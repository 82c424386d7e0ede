package com.gameinsights.anomaly.engine;

import com.gameinsights.anomaly.model.BucketedPoint;
import com.gameinsights.anomaly.model.Granularity;
import com.gameinsights.anomaly.model.SemanticType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups raw rows into period buckets and reduces each bucket to one value.
 *
 * User-count metrics (DAU-style) become the number of distinct user ids seen in the
 * period. Every other metric becomes the mean of its numeric value over the period's rows.
 */
@Component
public class TimeBucketer {

    static final String SINGLE_BUCKET_KEY = "all";

    private static final List<String> USER_COUNT_MARKERS = List.of("dau", "user");

    /**
     * @param rows            raw rows, left untouched
     * @param valueColumn     column holding the metric
     * @param metricType      semantic role of the metric column
     * @param timestampColumn column to bucket by; null collapses everything into one bucket
     * @param userIdColumn    user identifier column, or null
     * @param granularity     bucket width
     * @return points in ascending period order
     */
    public List<BucketedPoint> bucket(List<Map<String, Object>> rows,
                                      String valueColumn,
                                      SemanticType metricType,
                                      String timestampColumn,
                                      String userIdColumn,
                                      Granularity granularity) {
        boolean countUsers = userIdColumn != null && isUserCountMetric(valueColumn, metricType);
        Map<String, Bucket> buckets = new TreeMap<>();

        for (Map<String, Object> row : rows) {
            String key;
            if (timestampColumn != null) {
                Instant ts = RowValues.timestamp(row, timestampColumn);
                if (ts == null) {
                    continue;
                }
                key = granularity.periodKey(ts);
            } else {
                key = SINGLE_BUCKET_KEY;
            }

            Bucket bucket = buckets.computeIfAbsent(key, k -> new Bucket());
            if (countUsers) {
                Object userId = row.get(userIdColumn);
                String id = userId == null ? "" : String.valueOf(userId);
                if (!id.isEmpty()) {
                    bucket.users.add(id);
                }
            } else {
                bucket.sum += RowValues.number(row, valueColumn);
                bucket.count++;
            }
        }

        List<BucketedPoint> points = new ArrayList<>(buckets.size());
        for (Map.Entry<String, Bucket> entry : buckets.entrySet()) {
            points.add(new BucketedPoint(entry.getKey(), entry.getValue().value()));
        }
        return points;
    }

    static boolean isUserCountMetric(String valueColumn, SemanticType metricType) {
        if (metricType != null && metricType.isUserCount()) {
            return true;
        }
        String name = valueColumn.toLowerCase(Locale.ROOT);
        return USER_COUNT_MARKERS.stream().anyMatch(name::contains);
    }

    private static final class Bucket {
        private double sum;
        private int count;
        private final Set<String> users = new HashSet<>();

        private double value() {
            if (!users.isEmpty()) {
                return users.size();
            }
            return count > 0 ? sum / count : 0.0;
        }
    }
}
