package com.gameinsights.anomaly.engine.detectors;

import com.gameinsights.anomaly.config.AnomalyThresholdConfig;
import com.gameinsights.anomaly.engine.AnomalyDescriber;
import com.gameinsights.anomaly.engine.CauseAttributor;
import com.gameinsights.anomaly.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.gameinsights.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class CusumTrendDetectorTest {

    private CusumTrendDetector detector;

    @BeforeEach
    void setUp() {
        detector = new CusumTrendDetector(new CauseAttributor(), new AnomalyDescriber(), new AnomalyThresholdConfig());
    }

    @Test
    void detect_upwardShift_flaggedHighTrendShift() {
        // Baseline 100, control limit 50
        double[] values = concat(repeat(100, 7), new double[]{160}, repeat(100, 6));

        List<Anomaly> anomalies = detector.detect(revenueContext(values));

        assertThat(anomalies).hasSize(1);
        Anomaly shift = anomalies.get(0);
        assertThat(shift.getType()).isEqualTo(AnomalyType.TREND_SHIFT);
        assertThat(shift.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(shift.getDetector()).isEqualTo(DetectorType.CUSUM);
        assertThat(shift.getPeriod()).isEqualTo("2024-01-08");
        assertThat(shift.getExpectedValue()).isEqualTo(100.0);
        assertThat(shift.getDeviation()).isEqualTo(1.2);
        assertThat(shift.getPercentChange()).isEqualTo(60.0);
        assertThat(shift.getDescription())
                .isEqualTo("Significant upward trend change detected in revenue starting 2024-01-08");
    }

    @Test
    void detect_downwardShift_describedDownward() {
        double[] values = concat(repeat(100, 7), new double[]{40}, repeat(100, 6));

        List<Anomaly> anomalies = detector.detect(revenueContext(values));

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getDescription()).contains("downward");
        assertThat(anomalies.get(0).getPercentChange()).isEqualTo(-60.0);
    }

    @Test
    void detect_sumsResetAfterAlert() {
        // 160 crosses at index 7; 130 then 130 accumulate to 60 and cross again at index 9
        double[] values = concat(repeat(100, 7), new double[]{160, 130, 130}, repeat(100, 4));

        List<Anomaly> anomalies = detector.detect(revenueContext(values));

        assertThat(anomalies).extracting(Anomaly::getPeriod)
                .containsExactly("2024-01-08", "2024-01-10");
    }

    @Test
    void detect_slowDrift_accumulatesToAlert() {
        // +20 per period stays under the limit alone, crosses on the third period
        double[] values = concat(repeat(100, 7), repeat(120, 7));

        List<Anomaly> anomalies = detector.detect(revenueContext(values));

        assertThat(anomalies).extracting(Anomaly::getPeriod)
                .containsExactly("2024-01-10", "2024-01-13");
    }

    @Test
    void detect_fewerThanFourteenPoints_empty() {
        double[] values = concat(repeat(100, 7), new double[]{500}, repeat(100, 5));

        assertThat(detector.detect(revenueContext(values))).isEmpty();
    }

    @Test
    void detect_zeroBaseline_skipped() {
        assertThat(detector.detect(revenueContext(concat(repeat(0, 14), repeat(50, 14))))).isEmpty();
    }

    @Test
    void detect_stableSeries_nothingFlagged() {
        double[] values = concat(repeat(100, 7), new double[]{110, 90, 105, 95, 110, 90, 100});

        assertThat(detector.detect(revenueContext(values))).isEmpty();
    }
}
