package com.gameinsights.anomaly.controller;

import com.gameinsights.anomaly.model.DetectionConfig;
import com.gameinsights.anomaly.model.DetectionThresholds;
import com.gameinsights.anomaly.model.Granularity;
import com.gameinsights.anomaly.model.SemanticType;
import com.gameinsights.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime detection settings (thresholds, metrics, granularity)")
public class ConfigController {

    private static final int MAX_LOOKBACK_DAYS = 365;

    private final AnomalyDetectionService detectionService;

    public ConfigController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    // ── Thresholds ──

    @Operation(summary = "Get active detection thresholds")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        DetectionThresholds t = detectionService.getThresholds();
        return ResponseEntity.ok(Map.of(
                "lowStdDev", t.getLowStdDev(),
                "mediumStdDev", t.getMediumStdDev(),
                "highStdDev", t.getHighStdDev(),
                "criticalStdDev", t.getCriticalStdDev(),
                "minDataPoints", t.getMinDataPoints(),
                "minPercentChange", t.getMinPercentChange()
        ));
    }

    @Operation(summary = "Update active detection thresholds",
            description = "Partial update; omitted fields keep their value. Severity multiples must increase " +
                    "strictly from low to critical. Changes apply to the next run and reset on restart.")
    @PutMapping("/thresholds")
    public ResponseEntity<?> updateThresholds(@RequestBody Map<String, Object> body) {
        DetectionThresholds current = detectionService.getThresholds();
        double low = toDouble(body, "lowStdDev", current.getLowStdDev());
        double medium = toDouble(body, "mediumStdDev", current.getMediumStdDev());
        double high = toDouble(body, "highStdDev", current.getHighStdDev());
        double critical = toDouble(body, "criticalStdDev", current.getCriticalStdDev());
        int minPoints = toInt(body, "minDataPoints", current.getMinDataPoints());
        double minPct = toDouble(body, "minPercentChange", current.getMinPercentChange());

        if (low <= 0) return badRequest("lowStdDev must be > 0", "lowStdDev");
        if (medium <= low) return badRequest("mediumStdDev must be greater than lowStdDev", "mediumStdDev");
        if (high <= medium) return badRequest("highStdDev must be greater than mediumStdDev", "highStdDev");
        if (critical <= high) return badRequest("criticalStdDev must be greater than highStdDev", "criticalStdDev");
        if (minPoints < 1) return badRequest("minDataPoints must be >= 1", "minDataPoints");
        if (minPct < 0) return badRequest("minPercentChange must be >= 0", "minPercentChange");

        detectionService.updateThresholds(DetectionThresholds.builder()
                .lowStdDev(low)
                .mediumStdDev(medium)
                .highStdDev(high)
                .criticalStdDev(critical)
                .minDataPoints(minPoints)
                .minPercentChange(minPct)
                .build());

        return getThresholds();
    }

    // ── Detection defaults ──

    @Operation(summary = "Get default metrics, granularity and lookback window")
    @GetMapping("/detection")
    public ResponseEntity<Map<String, Object>> getDetectionDefaults() {
        DetectionConfig config = detectionService.getActiveConfig();
        return ResponseEntity.ok(Map.of(
                "metrics", config.getMetrics().stream().map(SemanticType::getKey).collect(Collectors.toList()),
                "granularity", config.getGranularity().name(),
                "lookbackDays", config.getLookbackDays()
        ));
    }

    @Operation(summary = "Update default metrics, granularity and lookback window",
            description = "Partial update. Metrics are semantic roles (e.g. revenue, dau, retention_day); " +
                    "lookbackDays is advisory. Changes reset on restart.")
    @PutMapping("/detection")
    public ResponseEntity<?> updateDetectionDefaults(@RequestBody Map<String, Object> body) {
        DetectionConfig current = detectionService.getActiveConfig();

        List<SemanticType> metrics = current.getMetrics();
        if (body.containsKey("metrics")) {
            Object raw = body.get("metrics");
            if (!(raw instanceof List<?> rawList) || rawList.isEmpty()) {
                return badRequest("metrics must be a non-empty list", "metrics");
            }
            List<SemanticType> parsed = rawList.stream()
                    .map(entry -> entry == null ? SemanticType.UNKNOWN : SemanticType.fromKey(entry.toString()))
                    .distinct()
                    .collect(Collectors.toList());
            if (!parsed.stream().allMatch(SemanticType::isMetricRole)) {
                return badRequest("metrics must be recognized metric roles", "metrics");
            }
            metrics = parsed;
        }

        Granularity granularity = current.getGranularity();
        if (body.containsKey("granularity")) {
            try {
                granularity = Granularity.valueOf(String.valueOf(body.get("granularity")).toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return badRequest("granularity must be one of HOUR, DAY, WEEK", "granularity");
            }
        }

        int lookbackDays = toInt(body, "lookbackDays", current.getLookbackDays());
        if (lookbackDays < 1 || lookbackDays > MAX_LOOKBACK_DAYS) {
            return badRequest("lookbackDays must be in [1, " + MAX_LOOKBACK_DAYS + "]", "lookbackDays");
        }

        detectionService.updateDefaults(DetectionConfig.builder()
                .metrics(List.copyOf(metrics))
                .granularity(granularity)
                .lookbackDays(lookbackDays)
                .build());

        return getDetectionDefaults();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
