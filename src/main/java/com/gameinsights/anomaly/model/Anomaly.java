package com.gameinsights.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "A single unusual period detected in a metric series")
public class Anomaly {

    @Schema(description = "Identifier unique within a run", example = "3f0c2a9e-1b7d-4c55-9a8e-2d6b0f1e7c41")
    String id;

    @Schema(description = "Column the anomaly was found in", example = "daily_revenue")
    String metric;

    @Schema(description = "Kind of anomaly", example = "SPIKE")
    AnomalyType type;

    @Schema(description = "Severity tier", example = "HIGH")
    Severity severity;

    @Schema(description = "Detector that emitted the anomaly", example = "Z_SCORE")
    DetectorType detector;

    @Schema(description = "Period key of the anomalous bucket", example = "2024-03-14")
    String period;

    @Schema(description = "Observed bucket value", example = "482.5")
    double value;

    @Schema(description = "Expected value (global mean, moving average or trend baseline)", example = "120.45")
    double expectedValue;

    @Schema(description = "Deviation magnitude. Z-score for Z_SCORE, relative deviation for MOVING_AVERAGE, " +
            "CUSUM-to-threshold ratio for CUSUM", example = "3.41")
    double deviation;

    @Schema(description = "Percent change vs the expected value", example = "300.58")
    double percentChange;

    @Schema(description = "Human-readable summary", example = "daily_revenue spiked 301% above baseline on 2024-03-14")
    String description;

    @Schema(description = "Up to three candidate causes for triage")
    List<String> possibleCauses;
}
