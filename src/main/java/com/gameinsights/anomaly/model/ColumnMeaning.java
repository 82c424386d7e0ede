package com.gameinsights.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Semantic role assigned to a raw column by the schema classifier")
public class ColumnMeaning {

    @Schema(description = "Raw column name", example = "daily_revenue")
    private String column;

    @Schema(description = "Semantic role of the column", example = "revenue")
    private SemanticType semanticType;

    @Schema(description = "Classifier confidence (0-1)", example = "0.92")
    private double confidence;
}
