package com.gameinsights.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@Schema(description = "Baseline statistics of a bucketed metric series")
public class BaselineStats {

    public static final BaselineStats EMPTY = new BaselineStats(0.0, 0.0, 0.0);

    @Schema(description = "Arithmetic mean", example = "120.45")
    double mean;

    @Schema(description = "Population standard deviation", example = "14.2")
    double stdDev;

    @Schema(description = "Median", example = "118.0")
    double median;

    public BaselineStats rounded() {
        return new BaselineStats(round2(mean), round2(stdDev), round2(median));
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
