package com.gameinsights.anomaly.service;

import com.gameinsights.anomaly.config.AnomalyThresholdConfig;
import com.gameinsights.anomaly.config.MetricsConfig;
import com.gameinsights.anomaly.engine.DetectionEngine;
import com.gameinsights.anomaly.model.DetectionConfig;
import com.gameinsights.anomaly.model.DetectionRequest;
import com.gameinsights.anomaly.model.DetectionResult;
import com.gameinsights.anomaly.model.DetectionThresholds;
import com.gameinsights.anomaly.model.SemanticType;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Host-facing entry point for anomaly detection.
 *
 * Holds the active detection settings (seeded from application config) and resolves
 * each request against them:
 * 1. Start from the active settings
 * 2. Overlay the request's metrics, granularity, lookback and partial thresholds
 * 3. Run the DetectionEngine on that snapshot
 * 4. Record run metrics
 *
 * The active settings are an immutable value swapped as a whole, so a run never sees a
 * half-applied update and updates never touch a snapshot already handed to the engine.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DetectionEngine detectionEngine;
    private final MetricsConfig metricsConfig;

    private volatile DetectionConfig activeConfig;

    public AnomalyDetectionService(DetectionEngine detectionEngine,
                                   AnomalyThresholdConfig thresholdConfig,
                                   MetricsConfig metricsConfig) {
        this.detectionEngine = detectionEngine;
        this.metricsConfig = metricsConfig;
        this.activeConfig = thresholdConfig.toDetectionConfig();
    }

    /**
     * Run a detection over the request's rows with the active settings plus any overrides.
     */
    @Observed(name = "anomaly.detect", contextualName = "detect-anomalies")
    public DetectionResult detect(DetectionRequest request) {
        DetectionConfig config = resolve(request.getConfig());
        int rowCount = request.getData() == null || request.getData().getRows() == null
                ? 0
                : request.getData().getRows().size();

        log.debug("Running anomaly detection: rows={}, metrics={}, granularity={}, lookbackDays={}",
                rowCount, config.getMetrics(), config.getGranularity(), config.getLookbackDays());

        DetectionResult result = detectionEngine.detect(request.getData(), request.getColumnMeanings(), config);

        metricsConfig.recordDetectionRun(config.getGranularity().name(), result.getAnomalies().size());
        log.info("Anomaly detection complete: {} rows, {} metrics analyzed, {} anomalies",
                rowCount, result.getMetricsAnalyzed().size(), result.getAnomalies().size());

        return result;
    }

    DetectionConfig resolve(DetectionRequest.Options options) {
        DetectionConfig base = activeConfig;
        if (options == null) {
            return base;
        }

        DetectionConfig.DetectionConfigBuilder resolved = base.toBuilder();
        if (options.getMetrics() != null) {
            List<SemanticType> metrics = options.getMetrics().stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
            if (!metrics.isEmpty()) {
                resolved.metrics(List.copyOf(metrics));
            }
        }
        if (options.getThresholds() != null) {
            resolved.thresholds(options.getThresholds().applyTo(base.getThresholds()));
        }
        if (options.getLookbackDays() != null) {
            resolved.lookbackDays(options.getLookbackDays());
        }
        if (options.getGranularity() != null) {
            resolved.granularity(options.getGranularity());
        }
        return resolved.build();
    }

    public DetectionConfig getActiveConfig() {
        return activeConfig;
    }

    public DetectionThresholds getThresholds() {
        return activeConfig.getThresholds().copy();
    }

    /**
     * Replace the active thresholds. Runs already in flight keep the thresholds they started with.
     */
    public synchronized DetectionThresholds updateThresholds(DetectionThresholds thresholds) {
        activeConfig = activeConfig.toBuilder().thresholds(thresholds.copy()).build();
        log.info("Active thresholds updated: {}", thresholds);
        return getThresholds();
    }

    /**
     * Replace the default metrics, granularity and lookback; thresholds are kept.
     */
    public synchronized DetectionConfig updateDefaults(DetectionConfig defaults) {
        activeConfig = defaults.toBuilder().thresholds(activeConfig.getThresholds()).build();
        log.info("Default detection settings updated: metrics={}, granularity={}, lookbackDays={}",
                activeConfig.getMetrics(), activeConfig.getGranularity(), activeConfig.getLookbackDays());
        return activeConfig;
    }
}
