package com.gameinsights.anomaly.engine.detectors;

import com.gameinsights.anomaly.config.AnomalyThresholdConfig;
import com.gameinsights.anomaly.engine.AnomalyDescriber;
import com.gameinsights.anomaly.engine.BaselineCalculator;
import com.gameinsights.anomaly.engine.CauseAttributor;
import com.gameinsights.anomaly.engine.DetectionContext;
import com.gameinsights.anomaly.engine.SeriesDetector;
import com.gameinsights.anomaly.model.Anomaly;
import com.gameinsights.anomaly.model.AnomalyType;
import com.gameinsights.anomaly.model.BucketedPoint;
import com.gameinsights.anomaly.model.DetectorType;
import com.gameinsights.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static com.gameinsights.anomaly.model.BaselineStats.round2;

/**
 * Compares each period with the mean of the periods right before it.
 *
 * Catches local regime changes that the global z-score misses, e.g. a slow drift that
 * widens the global standard deviation until no single point stands out.
 *
 * Logic: for every index i >= window, ma = mean(points[i-window .. i-1]).
 * Flag when |value - ma| / ma > movingAverageDeviation (30%) and the percent change
 * also reaches the minimum percent change. MEDIUM above movingAverageMediumDeviation
 * (50%), LOW otherwise. Windows averaging to 0 are skipped.
 */
@Component
public class MovingAverageDetector implements SeriesDetector {

    private final CauseAttributor causeAttributor;
    private final AnomalyDescriber describer;
    private final AnomalyThresholdConfig.Detectors settings;

    public MovingAverageDetector(CauseAttributor causeAttributor,
                                 AnomalyDescriber describer,
                                 AnomalyThresholdConfig config) {
        this.causeAttributor = causeAttributor;
        this.describer = describer;
        this.settings = config.getDetectors();
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.MOVING_AVERAGE;
    }

    @Override
    public List<Anomaly> detect(DetectionContext context) {
        List<BucketedPoint> points = context.getPoints();
        int windowSize = settings.getMovingAverageWindow();
        if (windowSize < 1 || points.size() < windowSize + 1) {
            return Collections.emptyList();
        }

        double minPercentChange = context.getThresholds().getMinPercentChange();
        List<Anomaly> anomalies = new ArrayList<>();

        for (int i = windowSize; i < points.size(); i++) {
            double movingAverage = BaselineCalculator.mean(points.subList(i - windowSize, i));
            if (movingAverage == 0) {
                continue;
            }

            BucketedPoint current = points.get(i);
            double relativeDeviation = Math.abs(current.getValue() - movingAverage) / movingAverage;
            double percentChange = (current.getValue() - movingAverage) / movingAverage * 100.0;

            if (relativeDeviation <= settings.getMovingAverageDeviation()
                    || Math.abs(percentChange) < minPercentChange) {
                continue;
            }

            AnomalyType type = current.getValue() > movingAverage ? AnomalyType.SPIKE : AnomalyType.DROP;
            Severity severity = relativeDeviation > settings.getMovingAverageMediumDeviation()
                    ? Severity.MEDIUM
                    : Severity.LOW;

            anomalies.add(Anomaly.builder()
                    .id(UUID.randomUUID().toString())
                    .metric(context.getColumn())
                    .type(type)
                    .severity(severity)
                    .detector(DetectorType.MOVING_AVERAGE)
                    .period(current.getPeriod())
                    .value(round2(current.getValue()))
                    .expectedValue(round2(movingAverage))
                    .deviation(round2(relativeDeviation))
                    .percentChange(round2(percentChange))
                    .description(describer.describeLocalDeviation(
                            context.getColumn(), relativeDeviation, windowSize, current.getPeriod()))
                    .possibleCauses(causeAttributor.possibleCauses(context.getMetricType(), context.getColumn()))
                    .build());
        }

        return anomalies;
    }
}
