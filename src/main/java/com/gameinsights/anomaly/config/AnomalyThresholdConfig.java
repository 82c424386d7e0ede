package com.gameinsights.anomaly.config;

import com.gameinsights.anomaly.model.DetectionConfig;
import com.gameinsights.anomaly.model.DetectionThresholds;
import com.gameinsights.anomaly.model.Granularity;
import com.gameinsights.anomaly.model.SemanticType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup defaults for anomaly detection. The service copies these into its active
 * settings once; runtime changes go through the service and reset on restart.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyThresholdConfig {

    // Severity multiples, minimum sample count and percent-change noise floor.
    private DetectionThresholds thresholds = new DetectionThresholds();

    // Semantic metric roles analyzed when a request names none.
    private List<SemanticType> metrics = new ArrayList<>(DetectionConfig.DEFAULT_METRICS);

    // Historical window in days. Advisory: callers pre-filter rows.
    private int lookbackDays = 30;

    private Granularity granularity = Granularity.DAY;

    // Detector tuning. Defaults are the published algorithm constants.
    private Detectors detectors = new Detectors();

    public DetectionConfig toDetectionConfig() {
        return DetectionConfig.builder()
                .metrics(List.copyOf(metrics))
                .thresholds(thresholds.copy())
                .lookbackDays(lookbackDays)
                .granularity(granularity)
                .build();
    }

    @Data
    public static class Detectors {
        // Moving average: preceding periods averaged for the local baseline
        private int movingAverageWindow = 7;
        // Relative deviation from the local mean required to flag a point
        private double movingAverageDeviation = 0.3;
        // Relative deviation above which a local anomaly is MEDIUM instead of LOW
        private double movingAverageMediumDeviation = 0.5;

        // CUSUM: leading points forming the fixed reference level
        private int cusumBaselineWindow = 7;
        private int cusumMinDataPoints = 14;
        // Control limit as a fraction of the baseline mean
        private double cusumThresholdFraction = 0.5;
    }
}
