package com.gameinsights.anomaly.engine;

import com.gameinsights.anomaly.config.MetricsConfig;
import com.gameinsights.anomaly.model.Anomaly;
import com.gameinsights.anomaly.model.BaselineStats;
import com.gameinsights.anomaly.model.BucketedPoint;
import com.gameinsights.anomaly.model.ColumnMeaning;
import com.gameinsights.anomaly.model.DetectionConfig;
import com.gameinsights.anomaly.model.DetectionResult;
import com.gameinsights.anomaly.model.DetectorType;
import com.gameinsights.anomaly.model.NormalizedData;
import com.gameinsights.anomaly.model.SemanticType;
import com.gameinsights.anomaly.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Core detection engine: buckets every requested metric, computes its baseline and runs
 * all registered detectors against it, then merges and ranks the results.
 * Uses the Strategy pattern: each DetectorType is handled by a registered SeriesDetector.
 *
 * The engine holds no per-run state. Everything a run depends on arrives as arguments,
 * so one instance can serve concurrent callers.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    static final Comparator<Anomaly> RANKING = Comparator
            .comparingInt((Anomaly a) -> a.getSeverity().rank())
            .thenComparing(Anomaly::getPeriod, Comparator.reverseOrder());

    private final Map<DetectorType, SeriesDetector> detectorMap;
    private final TimeBucketer timeBucketer;
    private final MetricsConfig metricsConfig;

    public DetectionEngine(List<SeriesDetector> detectors, TimeBucketer timeBucketer, MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(DetectorType.class);
        this.timeBucketer = timeBucketer;
        this.metricsConfig = metricsConfig;

        // Auto-register all detector implementations
        for (SeriesDetector detector : detectors) {
            detectorMap.put(detector.getDetectorType(), detector);
            log.info("Registered series detector: {} -> {}",
                    detector.getDetectorType(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Scan a row batch for anomalies in every requested metric.
     *
     * @param data           normalized rows
     * @param columnMeanings semantic role of each column
     * @param config         resolved settings for this run
     * @return merged and ranked result; never null, possibly empty
     */
    public DetectionResult detect(NormalizedData data, List<ColumnMeaning> columnMeanings, DetectionConfig config) {
        List<Map<String, Object>> rows = data == null || data.getRows() == null
                ? Collections.emptyList()
                : data.getRows();
        List<ColumnMeaning> meanings = columnMeanings == null ? Collections.emptyList() : columnMeanings;

        String timestampColumn = findColumn(meanings, SemanticType.TIMESTAMP);
        String userIdColumn = findColumn(meanings, SemanticType.USER_ID);

        List<Anomaly> anomalies = new ArrayList<>();
        List<String> metricsAnalyzed = new ArrayList<>();
        Map<String, BaselineStats> baselineStats = new LinkedHashMap<>();

        for (SemanticType metric : new LinkedHashSet<>(config.getMetrics())) {
            if (metric == null || !metric.isMetricRole()) {
                log.debug("Ignoring requested metric {}: not a metric role", metric);
                metricsConfig.recordMetricSkipped("not_a_metric");
                continue;
            }
            String column = findColumn(meanings, metric);
            if (column == null) {
                metricsConfig.recordMetricSkipped("no_column");
                continue;
            }
            if (metricsAnalyzed.contains(column)) {
                continue;
            }
            metricsAnalyzed.add(column);

            List<BucketedPoint> points = timeBucketer.bucket(
                    rows, column, metric, timestampColumn, userIdColumn, config.getGranularity());

            if (points.size() < config.getThresholds().getMinDataPoints()) {
                log.debug("Skipping {}: {} bucketed points, need {}",
                        column, points.size(), config.getThresholds().getMinDataPoints());
                metricsConfig.recordMetricSkipped("insufficient_samples");
                continue;
            }

            BaselineStats baseline = BaselineCalculator.calculate(points);
            baselineStats.put(column, baseline.rounded());

            if (!BaselineCalculator.hasVariance(baseline)) {
                log.debug("No variance in {} (constant {}), nothing to flag", column, baseline.getMean());
                metricsConfig.recordMetricSkipped("no_variance");
                continue;
            }

            DetectionContext context = DetectionContext.builder()
                    .column(column)
                    .metricType(metric)
                    .points(points)
                    .baseline(baseline)
                    .thresholds(config.getThresholds())
                    .build();

            anomalies.addAll(runDetectors(context));
        }

        anomalies.sort(RANKING);

        return DetectionResult.builder()
                .anomalies(Collections.unmodifiableList(anomalies))
                .metricsAnalyzed(Collections.unmodifiableList(metricsAnalyzed))
                .timeRange(timeRange(rows, timestampColumn))
                .baselineStats(Collections.unmodifiableMap(baselineStats))
                .build();
    }

    private List<Anomaly> runDetectors(DetectionContext context) {
        List<Anomaly> found = new ArrayList<>();

        for (SeriesDetector detector : detectorMap.values()) {
            try {
                List<Anomaly> result = detector.detect(context);
                for (Anomaly anomaly : result) {
                    metricsConfig.recordAnomaly(detector.getDetectorType().name(), anomaly.getSeverity().name());
                    log.debug("Anomaly in {} at {}: {} {} (deviation={}, change={}%)",
                            anomaly.getMetric(), anomaly.getPeriod(), anomaly.getSeverity(),
                            anomaly.getType(), anomaly.getDeviation(), anomaly.getPercentChange());
                }
                found.addAll(result);
            } catch (RuntimeException e) {
                metricsConfig.recordDetectorFailure(detector.getDetectorType().name());
                log.error("Error running detector {} on {}: {}",
                        detector.getDetectorType(), context.getColumn(), e.getMessage(), e);
                // Other detectors still report
            }
        }

        return found;
    }

    /**
     * Calendar dates (UTC) of the earliest and latest readable timestamp in the batch,
     * independent of any metric's bucketing.
     */
    static TimeRange timeRange(List<Map<String, Object>> rows, String timestampColumn) {
        if (timestampColumn == null) {
            return null;
        }
        Instant min = null;
        Instant max = null;
        for (Map<String, Object> row : rows) {
            Instant ts = RowValues.timestamp(row, timestampColumn);
            if (ts == null) {
                continue;
            }
            if (min == null || ts.isBefore(min)) min = ts;
            if (max == null || ts.isAfter(max)) max = ts;
        }
        if (min == null) {
            return null;
        }
        return new TimeRange(toDate(min), toDate(max));
    }

    private static String toDate(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC).toString();
    }

    private static String findColumn(List<ColumnMeaning> meanings, SemanticType type) {
        return meanings.stream()
                .filter(m -> m.getSemanticType() == type && m.getColumn() != null)
                .map(ColumnMeaning::getColumn)
                .findFirst()
                .orElse(null);
    }
}
