package com.gameinsights.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial threshold settings supplied with a single detection request.
 * Null fields keep the active value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-request threshold overrides; omitted fields fall back to the active thresholds")
public class ThresholdOverrides {

    @Schema(example = "2.0")
    private Double lowStdDev;

    @Schema(example = "2.5")
    private Double mediumStdDev;

    @Schema(example = "3.0")
    private Double highStdDev;

    @Schema(example = "4.0")
    private Double criticalStdDev;

    @Schema(example = "7")
    private Integer minDataPoints;

    @Schema(example = "20")
    private Double minPercentChange;

    public DetectionThresholds applyTo(DetectionThresholds base) {
        DetectionThresholds.DetectionThresholdsBuilder merged = base.toBuilder();
        if (lowStdDev != null) merged.lowStdDev(lowStdDev);
        if (mediumStdDev != null) merged.mediumStdDev(mediumStdDev);
        if (highStdDev != null) merged.highStdDev(highStdDev);
        if (criticalStdDev != null) merged.criticalStdDev(criticalStdDev);
        if (minDataPoints != null) merged.minDataPoints(minDataPoints);
        if (minPercentChange != null) merged.minPercentChange(minPercentChange);
        return merged.build();
    }
}
