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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static com.gameinsights.anomaly.model.BaselineStats.round2;

/**
 * Detects sustained level shifts with a two-sided cumulative sum (CUSUM) control chart.
 *
 * The first cusumBaselineWindow points (7) fix the reference level; it is not updated
 * afterwards. From there on:
 *   cusumPos = max(0, cusumPos + (value - baselineMean))
 *   cusumNeg = min(0, cusumNeg + (value - baselineMean))
 * and a TREND_SHIFT (always HIGH) is reported at the first period where either sum's
 * magnitude exceeds baselineMean * cusumThresholdFraction. Both sums then restart at 0,
 * so a drift smaller than the limit per period is reported once every few periods
 * rather than at every period after it first crosses.
 *
 * Needs at least cusumMinDataPoints (14) points. A baseline level of 0 or below gives
 * no usable control limit and the series is skipped.
 */
@Component
public class CusumTrendDetector implements SeriesDetector {

    private static final Logger log = LoggerFactory.getLogger(CusumTrendDetector.class);

    private final CauseAttributor causeAttributor;
    private final AnomalyDescriber describer;
    private final AnomalyThresholdConfig.Detectors settings;

    public CusumTrendDetector(CauseAttributor causeAttributor,
                              AnomalyDescriber describer,
                              AnomalyThresholdConfig config) {
        this.causeAttributor = causeAttributor;
        this.describer = describer;
        this.settings = config.getDetectors();
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.CUSUM;
    }

    @Override
    public List<Anomaly> detect(DetectionContext context) {
        List<BucketedPoint> points = context.getPoints();
        int baselineWindow = settings.getCusumBaselineWindow();
        int minPoints = Math.max(settings.getCusumMinDataPoints(), baselineWindow + 1);
        if (baselineWindow < 1 || points.size() < minPoints) {
            return Collections.emptyList();
        }

        double baselineMean = BaselineCalculator.mean(points.subList(0, baselineWindow));
        double threshold = baselineMean * settings.getCusumThresholdFraction();
        if (threshold <= 0) {
            log.debug("Skipping trend-shift scan for {}: baseline level {} gives no control limit",
                    context.getColumn(), baselineMean);
            return Collections.emptyList();
        }

        List<Anomaly> anomalies = new ArrayList<>();
        double cusumPos = 0.0;
        double cusumNeg = 0.0;

        for (int i = baselineWindow; i < points.size(); i++) {
            BucketedPoint point = points.get(i);
            double diff = point.getValue() - baselineMean;
            cusumPos = Math.max(0.0, cusumPos + diff);
            cusumNeg = Math.min(0.0, cusumNeg + diff);

            if (cusumPos <= threshold && Math.abs(cusumNeg) <= threshold) {
                continue;
            }

            boolean upward = cusumPos > threshold;
            double deviation = Math.max(cusumPos, Math.abs(cusumNeg)) / threshold;
            double percentChange = diff / baselineMean * 100.0;

            anomalies.add(Anomaly.builder()
                    .id(UUID.randomUUID().toString())
                    .metric(context.getColumn())
                    .type(AnomalyType.TREND_SHIFT)
                    .severity(Severity.HIGH)
                    .detector(DetectorType.CUSUM)
                    .period(point.getPeriod())
                    .value(round2(point.getValue()))
                    .expectedValue(round2(baselineMean))
                    .deviation(round2(deviation))
                    .percentChange(round2(percentChange))
                    .description(describer.describeTrendShift(context.getColumn(), upward, point.getPeriod()))
                    .possibleCauses(causeAttributor.possibleCauses(context.getMetricType(), context.getColumn()))
                    .build());

            cusumPos = 0.0;
            cusumNeg = 0.0;
        }

        return anomalies;
    }
}
