package com.gameinsights.anomaly.engine.detectors;

import com.gameinsights.anomaly.engine.AnomalyDescriber;
import com.gameinsights.anomaly.engine.BaselineCalculator;
import com.gameinsights.anomaly.engine.CauseAttributor;
import com.gameinsights.anomaly.engine.DetectionContext;
import com.gameinsights.anomaly.engine.SeriesDetector;
import com.gameinsights.anomaly.model.Anomaly;
import com.gameinsights.anomaly.model.AnomalyType;
import com.gameinsights.anomaly.model.BaselineStats;
import com.gameinsights.anomaly.model.BucketedPoint;
import com.gameinsights.anomaly.model.DetectionThresholds;
import com.gameinsights.anomaly.model.DetectorType;
import com.gameinsights.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static com.gameinsights.anomaly.model.BaselineStats.round2;

/**
 * Flags periods that sit far from the global mean of the series.
 *
 * Logic: z = (value - mean) / stdDev. A point is reported when |z| reaches the low
 * threshold AND its percent change vs the mean reaches the minimum percent change;
 * the second condition suppresses statistically large but practically tiny moves.
 * Severity is the highest tier whose multiple |z| reaches.
 *
 * Example: mean = 100, stdDev = 10, value = 135 gives z = 3.5 and +35%,
 * reported as a HIGH spike with the default thresholds.
 */
@Component
public class ZScoreDetector implements SeriesDetector {

    private final CauseAttributor causeAttributor;
    private final AnomalyDescriber describer;

    public ZScoreDetector(CauseAttributor causeAttributor, AnomalyDescriber describer) {
        this.causeAttributor = causeAttributor;
        this.describer = describer;
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.Z_SCORE;
    }

    @Override
    public List<Anomaly> detect(DetectionContext context) {
        BaselineStats baseline = context.getBaseline();
        // No spread means no z-score; no mean means no percent change.
        if (!BaselineCalculator.hasVariance(baseline) || baseline.getMean() == 0) {
            return Collections.emptyList();
        }

        DetectionThresholds thresholds = context.getThresholds();
        double mean = baseline.getMean();
        double stdDev = baseline.getStdDev();
        List<Anomaly> anomalies = new ArrayList<>();

        for (BucketedPoint point : context.getPoints()) {
            double zScore = (point.getValue() - mean) / stdDev;
            if (Math.abs(zScore) < thresholds.getLowStdDev()) {
                continue;
            }

            double percentChange = (point.getValue() - mean) / mean * 100.0;
            if (Math.abs(percentChange) < thresholds.getMinPercentChange()) {
                continue;
            }

            AnomalyType type = point.getValue() > mean ? AnomalyType.SPIKE : AnomalyType.DROP;

            anomalies.add(Anomaly.builder()
                    .id(UUID.randomUUID().toString())
                    .metric(context.getColumn())
                    .type(type)
                    .severity(Severity.fromZScore(zScore, thresholds))
                    .detector(DetectorType.Z_SCORE)
                    .period(point.getPeriod())
                    .value(round2(point.getValue()))
                    .expectedValue(round2(mean))
                    .deviation(round2(zScore))
                    .percentChange(round2(percentChange))
                    .description(describer.describe(type, context.getColumn(), percentChange, point.getPeriod()))
                    .possibleCauses(causeAttributor.possibleCauses(context.getMetricType(), context.getColumn()))
                    .build());
        }

        return anomalies;
    }
}
