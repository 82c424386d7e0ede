package com.gameinsights.anomaly.engine;

import com.gameinsights.anomaly.model.BaselineStats;
import com.gameinsights.anomaly.model.BucketedPoint;

import java.util.Arrays;
import java.util.List;

/**
 * Baseline statistics over a bucketed series.
 */
public final class BaselineCalculator {

    // Below this a standard deviation is rounding noise from a constant series.
    private static final double MIN_STD_DEV = 1e-10;

    private BaselineCalculator() {}

    public static boolean hasVariance(BaselineStats stats) {
        return stats.getStdDev() >= MIN_STD_DEV;
    }

    /**
     * Mean, population standard deviation (divide by n) and median. An empty series
     * yields all zeros; callers check the sample count before trusting the result.
     */
    public static BaselineStats calculate(List<BucketedPoint> points) {
        if (points == null || points.isEmpty()) {
            return BaselineStats.EMPTY;
        }
        double[] values = points.stream().mapToDouble(BucketedPoint::getValue).toArray();
        double mean = mean(values);

        double sumSquaredDiffs = 0.0;
        for (double value : values) {
            double diff = value - mean;
            sumSquaredDiffs += diff * diff;
        }
        double stdDev = Math.sqrt(sumSquaredDiffs / values.length);

        return new BaselineStats(mean, stdDev, median(values));
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double mean(List<BucketedPoint> points) {
        return mean(points.stream().mapToDouble(BucketedPoint::getValue).toArray());
    }

    static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 != 0
                ? sorted[mid]
                : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
