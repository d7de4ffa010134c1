package com.spansentinel.core.stats;

import com.spansentinel.core.model.BaselineStats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Reduces a window of historical samples to a {@link BaselineStats}.
 *
 * <p>
 * The input is copied and sorted; the caller's array is never modified.
 * Standard deviation is the population form (divide by {@code n}).
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineStatsCalculator {

    private BaselineStatsCalculator() {
        // utility class, not instantiable
    }

    /**
     * Compute the baseline summary of {@code samples}.
     *
     * @param samples historical values in any order; must not be {@code null}
     * @return the summary, or {@link BaselineStats#EMPTY} for an empty input
     * @throws NullPointerException if {@code samples} is {@code null}
     */
    public static BaselineStats calculate(double[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        int n = samples.length;
        if (n == 0) {
            return BaselineStats.EMPTY;
        }

        double[] sorted = samples.clone();
        Arrays.sort(sorted);

        double sum = 0;
        for (double v : sorted) {
            sum += v;
        }
        double mean = sum / n;

        double sumSquaredDiff = 0;
        for (double v : sorted) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        double stdDev = Math.sqrt(sumSquaredDiff / n);

        double median = Percentiles.median(sorted);
        double q1 = Percentiles.percentile(sorted, 25);
        double q3 = Percentiles.percentile(sorted, 75);

        return BaselineStats.builder()
                .mean(mean)
                .stdDev(stdDev)
                .median(median)
                .p95(Percentiles.percentile(sorted, 95))
                .p99(Percentiles.percentile(sorted, 99))
                .min(sorted[0])
                .max(sorted[n - 1])
                .q1(q1)
                .q3(q3)
                .iqr(q3 - q1)
                .mad(medianAbsoluteDeviation(sorted, median))
                .build();
    }

    private static double medianAbsoluteDeviation(double[] sorted, double median) {
        double[] deviations = new double[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            deviations[i] = Math.abs(sorted[i] - median);
        }
        Arrays.sort(deviations);
        return Percentiles.median(deviations);
    }
}
