package com.gameinsights.anomaly.controller;

import com.gameinsights.anomaly.engine.MetricCategory;
import com.gameinsights.anomaly.model.DetectionRequest;
import com.gameinsights.anomaly.model.DetectionResult;
import com.gameinsights.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Scan game-analytics row batches for spikes, drops and trend shifts")
public class AnomalyController {

    private final AnomalyDetectionService detectionService;

    public AnomalyController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Detect anomalies in a row batch",
            description = "Buckets each requested metric by period, computes its baseline and runs the " +
                    "z-score, moving-average and CUSUM detectors. Returns anomalies ranked by severity " +
                    "then recency, the analyzed columns, the batch's date range and per-column baselines. " +
                    "Request-level config overrides the active settings for this run only.")
    @ApiResponse(responseCode = "200", description = "Detection completed",
            content = @Content(schema = @Schema(implementation = DetectionResult.class)))
    @ApiResponse(responseCode = "400", description = "Missing rows or column mapping, or invalid overrides " +
            "(including metrics that are not recognized metric roles)")
    @PostMapping("/detect")
    public ResponseEntity<?> detect(@RequestBody DetectionRequest request) {
        if (request.getData() == null || request.getData().getRows() == null) {
            return badRequest("data.rows is required", "data");
        }
        if (request.getColumnMeanings() == null) {
            return badRequest("columnMeanings is required", "columnMeanings");
        }
        if (request.getConfig() != null && request.getConfig().getLookbackDays() != null
                && request.getConfig().getLookbackDays() <= 0) {
            return badRequest("lookbackDays must be > 0", "config.lookbackDays");
        }
        if (request.getConfig() != null && request.getConfig().getMetrics() != null
                && !request.getConfig().getMetrics().stream().allMatch(m -> m != null && m.isMetricRole())) {
            return badRequest("metrics must be recognized metric roles", "config.metrics");
        }

        DetectionResult result = detectionService.detect(request);
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "List metric categories and their candidate causes",
            description = "Categories are matched by keyword against the metric's semantic role, then its column name.")
    @GetMapping("/categories")
    public ResponseEntity<Map<String, Object>> getCategories() {
        Map<String, Object> categories = new LinkedHashMap<>();
        for (MetricCategory category : MetricCategory.values()) {
            categories.put(category.name(), Map.of(
                    "keywords", category.getKeywords(),
                    "possibleCauses", List.copyOf(category.getCauses())
            ));
        }
        return ResponseEntity.ok(categories);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
