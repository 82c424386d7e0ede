package com.gameinsights.anomaly.engine;

import com.gameinsights.anomaly.model.AnomalyType;
import org.springframework.stereotype.Component;

/**
 * Templated one-line descriptions for operators. Percentages are rounded to whole numbers.
 */
@Component
public class AnomalyDescriber {

    public String describe(AnomalyType type, String column, double percentChange, String period) {
        long absChange = Math.abs(Math.round(percentChange));
        switch (type) {
            case SPIKE:
                return String.format("%s spiked %d%% above baseline on %s", column, absChange, period);
            case DROP:
                return String.format("%s dropped %d%% below baseline on %s", column, absChange, period);
            case TREND_SHIFT:
                String direction = percentChange > 0 ? "increased" : "decreased";
                return String.format("%s %s by %d%% indicating a trend change on %s",
                        column, direction, absChange, period);
            case PATTERN_BREAK:
            default:
                return String.format("Unusual pattern detected in %s on %s", column, period);
        }
    }

    public String describeLocalDeviation(String column, double relativeDeviation, int windowSize, String period) {
        return String.format("%s deviated %d%% from %d-period moving average on %s",
                column, Math.round(relativeDeviation * 100), windowSize, period);
    }

    public String describeTrendShift(String column, boolean upward, String period) {
        return String.format("Significant %s trend change detected in %s starting %s",
                upward ? "upward" : "downward", column, period);
    }
}
