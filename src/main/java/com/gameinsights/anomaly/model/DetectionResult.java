package com.gameinsights.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Merged, ranked output of all detectors over all analyzed metrics")
public class DetectionResult {

    @Schema(description = "Anomalies ordered by severity (critical first), then most recent period first")
    List<Anomaly> anomalies;

    @Schema(description = "Columns that matched a requested metric role", example = "[\"daily_revenue\", \"dau\"]")
    List<String> metricsAnalyzed;

    @Schema(description = "Overall date range of the batch; null when no timestamp could be read", nullable = true)
    @JsonInclude(JsonInclude.Include.ALWAYS)
    TimeRange timeRange;

    @Schema(description = "Baseline statistics per analyzed column, rounded to 2 decimals")
    Map<String, BaselineStats> baselineStats;
}
