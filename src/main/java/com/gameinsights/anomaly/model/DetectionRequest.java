package com.gameinsights.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Row batch plus column mapping to scan for anomalies")
public class DetectionRequest {

    @Schema(description = "Normalized rows to analyze", requiredMode = Schema.RequiredMode.REQUIRED)
    private NormalizedData data;

    @Schema(description = "Semantic column mapping from the schema classifier", requiredMode = Schema.RequiredMode.REQUIRED)
    private List<ColumnMeaning> columnMeanings;

    @Schema(description = "Optional overrides of the active detection settings")
    private Options config;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Options {

        @Schema(description = "Semantic metric roles to analyze", example = "[\"revenue\", \"dau\"]")
        private List<SemanticType> metrics;

        @Schema(description = "Threshold overrides for this run only")
        private ThresholdOverrides thresholds;

        @Schema(description = "Historical window in days (advisory)", example = "30")
        private Integer lookbackDays;

        @Schema(description = "Bucket width", example = "DAY")
        private Granularity granularity;
    }
}
