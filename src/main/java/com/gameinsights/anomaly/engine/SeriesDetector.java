package com.gameinsights.anomaly.engine;

import com.gameinsights.anomaly.model.Anomaly;
import com.gameinsights.anomaly.model.DetectorType;

import java.util.List;

/**
 * Interface for all metric-series detectors.
 * Each implementation handles a specific DetectorType and is independent of the others:
 * detectors see the same series and baseline, and the order they run in does not matter.
 */
public interface SeriesDetector {

    /**
     * The detector type this implementation provides.
     */
    DetectorType getDetectorType();

    /**
     * Scan one metric's bucketed series.
     *
     * @param context the series, its baseline and the thresholds for this run
     * @return anomalies found, empty when the series is normal or cannot be analyzed
     */
    List<Anomaly> detect(DetectionContext context);
}
