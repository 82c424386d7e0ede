package com.gameinsights.anomaly.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Tier for a z-score magnitude. Callers drop points below the low threshold
     * before asking, so anything under medium comes back as LOW.
     */
    public static Severity fromZScore(double zScore, DetectionThresholds thresholds) {
        double absZ = Math.abs(zScore);
        if (absZ >= thresholds.getCriticalStdDev()) return CRITICAL;
        if (absZ >= thresholds.getHighStdDev()) return HIGH;
        if (absZ >= thresholds.getMediumStdDev()) return MEDIUM;
        return LOW;
    }

    // Sort position in a result: critical first.
    public int rank() {
        return CRITICAL.ordinal() - ordinal();
    }
}
