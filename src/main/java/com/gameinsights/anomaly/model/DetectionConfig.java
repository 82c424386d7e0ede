package com.gameinsights.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Fully resolved settings for one detection run. Built by the service from the
 * active defaults plus any request overrides, then handed to the engine as-is.
 */
@Value
@Builder(toBuilder = true)
public class DetectionConfig {

    public static final List<SemanticType> DEFAULT_METRICS = List.of(
            SemanticType.REVENUE,
            SemanticType.DAU,
            SemanticType.RETENTION_DAY,
            SemanticType.LEVEL,
            SemanticType.ERROR_TYPE);

    @Builder.Default
    List<SemanticType> metrics = DEFAULT_METRICS;

    @Builder.Default
    DetectionThresholds thresholds = new DetectionThresholds();

    // Advisory only: rows are not filtered by it, callers pre-filter the batch.
    @Builder.Default
    int lookbackDays = 30;

    @Builder.Default
    Granularity granularity = Granularity.DAY;
}
