package com.gameinsights.anomaly.model;

public enum AnomalyType {
    SPIKE,
    DROP,
    TREND_SHIFT,
    PATTERN_BREAK
}
