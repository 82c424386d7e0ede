package com.gameinsights.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Row batch produced by a data source adapter")
public class NormalizedData {

    @Schema(description = "Column names in source order", example = "[\"timestamp\", \"user_id\", \"revenue\"]")
    @Builder.Default
    private List<String> columns = new ArrayList<>();

    @Schema(description = "Rows keyed by column name; values may be strings, numbers, booleans or null")
    @Builder.Default
    private List<Map<String, Object>> rows = new ArrayList<>();

    @Schema(description = "Where the batch came from")
    private Metadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        @Schema(description = "Adapter that produced the batch", example = "csv")
        private String source;

        @Schema(description = "Fetch time as an ISO instant", example = "2024-03-01T12:00:00Z")
        private String fetchedAt;

        @Schema(description = "Number of rows fetched", example = "1200")
        private long rowCount;
    }
}
