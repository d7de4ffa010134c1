package com.spansentinel.core.stats;

import java.util.Objects;

/**
 * Percentile estimation by linear interpolation between the two closest
 * order statistics.
 *
 * @since 1.0.0
 */
public final class Percentiles {

    private Percentiles() {
        // utility class, not instantiable
    }

    /**
     * Estimate the {@code p}-th percentile of an ascending-sorted sequence.
     *
     * <p>
     * {@code rank = p/100 · (n-1)}; the result interpolates between
     * {@code sorted[floor(rank)]} and the next element. An empty input yields
     * {@code 0} and a single-element input yields that element.
     * </p>
     *
     * @param sorted samples in ascending order; not checked for ordering
     * @param p      percentile in {@code [0, 100]}
     * @return the interpolated percentile
     * @throws NullPointerException     if {@code sorted} is {@code null}
     * @throws IllegalArgumentException if {@code p} is outside {@code [0, 100]}
     */
    public static double percentile(double[] sorted, double p) {
        Objects.requireNonNull(sorted, "sorted samples must not be null");
        if (Double.isNaN(p) || p < 0 || p > 100) {
            throw new IllegalArgumentException("Percentile must be in [0, 100], got: " + p);
        }

        int n = sorted.length;
        if (n == 0) {
            return 0;
        }
        if (n == 1) {
            return sorted[0];
        }

        double rank = (p / 100) * (n - 1);
        int lower = (int) Math.floor(rank);
        int upper = lower + 1;
        if (upper >= n) {
            return sorted[n - 1];
        }

        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    /**
     * Median of an ascending-sorted sequence: the middle element, or the mean
     * of the two middle elements when the length is even.
     *
     * @param sorted samples in ascending order
     * @return the median, {@code 0} for an empty input
     */
    public static double median(double[] sorted) {
        Objects.requireNonNull(sorted, "sorted samples must not be null");
        int n = sorted.length;
        if (n == 0) {
            return 0;
        }
        if (n % 2 == 0) {
            return (sorted[n / 2 - 1] + sorted[n / 2]) / 2;
        }
        return sorted[n / 2];
    }
}
