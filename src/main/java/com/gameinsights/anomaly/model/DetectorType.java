package com.gameinsights.anomaly.model;

/**
 * Statistical detectors run against every bucketed metric series.
 */
public enum DetectorType {
    Z_SCORE,            // Global deviation from the series mean
    MOVING_AVERAGE,     // Deviation from the preceding window's mean
    CUSUM               // Sustained shift away from the opening baseline
}
