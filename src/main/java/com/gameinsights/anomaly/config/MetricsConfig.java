package com.gameinsights.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetectionRun(String granularity, int anomalyCount) {
        Counter.builder("detection.run.count")
                .tag("granularity", granularity)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.anomalies_per_run")
                .tag("granularity", granularity)
                .register(registry)
                .record(anomalyCount);
    }

    public void recordAnomaly(String detector, String severity) {
        Counter.builder("anomaly.detected.count")
                .tag("detector", detector)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordMetricSkipped(String reason) {
        Counter.builder("metric.skipped.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDetectorFailure(String detector) {
        Counter.builder("detector.failure.count")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }
}
