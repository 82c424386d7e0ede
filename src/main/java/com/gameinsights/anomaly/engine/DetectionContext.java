package com.gameinsights.anomaly.engine;

import com.gameinsights.anomaly.model.BaselineStats;
import com.gameinsights.anomaly.model.BucketedPoint;
import com.gameinsights.anomaly.model.DetectionThresholds;
import com.gameinsights.anomaly.model.SemanticType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a detector needs about one metric's series. Built once per metric by
 * the engine and shared by all detectors.
 */
@Value
@Builder
public class DetectionContext {
    // Column the series was built from
    String column;

    // Semantic role the column was matched under
    SemanticType metricType;

    // Bucketed series, ascending by period
    List<BucketedPoint> points;

    // Unrounded baseline of the whole series
    BaselineStats baseline;

    DetectionThresholds thresholds;
}
