package com.gameinsights.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Severity multiples and noise floors applied by the detectors")
public class DetectionThresholds {

    @Schema(description = "Minimum |z| (in standard deviations) for a LOW anomaly", example = "2.0")
    @Builder.Default
    private double lowStdDev = 2.0;

    @Schema(description = "Minimum |z| for a MEDIUM anomaly", example = "2.5")
    @Builder.Default
    private double mediumStdDev = 2.5;

    @Schema(description = "Minimum |z| for a HIGH anomaly", example = "3.0")
    @Builder.Default
    private double highStdDev = 3.0;

    @Schema(description = "Minimum |z| for a CRITICAL anomaly", example = "4.0")
    @Builder.Default
    private double criticalStdDev = 4.0;

    @Schema(description = "Minimum bucketed points before a metric is analyzed", example = "7")
    @Builder.Default
    private int minDataPoints = 7;

    @Schema(description = "Minimum |% change| vs baseline; smaller deviations are treated as noise", example = "20")
    @Builder.Default
    private double minPercentChange = 20.0;

    public DetectionThresholds copy() {
        return toBuilder().build();
    }
}
