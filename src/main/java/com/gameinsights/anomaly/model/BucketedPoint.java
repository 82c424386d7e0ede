package com.gameinsights.anomaly.model;

import lombok.Value;

/**
 * One aggregated period of a metric series.
 */
@Value
public class BucketedPoint {
    String period;
    double value;
}
