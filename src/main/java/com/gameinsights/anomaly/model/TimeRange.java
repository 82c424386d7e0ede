package com.gameinsights.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@Schema(description = "First and last calendar date (UTC) seen in the timestamp column")
public class TimeRange {

    @Schema(example = "2024-02-01")
    String start;

    @Schema(example = "2024-03-01")
    String end;
}
