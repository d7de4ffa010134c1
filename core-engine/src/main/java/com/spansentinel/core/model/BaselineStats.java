package com.spansentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable statistical summary of one historical sample window.
 *
 * <p>
 * Recomputed on every detection call; instances are never cached or mutated.
 * Use {@link #builder()} to construct.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineStats implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Summary of an empty sample window: every field is zero. */
    public static final BaselineStats EMPTY = builder().build();

    private final double mean;
    private final double stdDev;
    private final double median;
    private final double p95;
    private final double p99;
    private final double min;
    private final double max;
    private final double q1;
    private final double q3;
    private final double iqr;
    private final double mad;

    @JsonCreator
    public BaselineStats(@JsonProperty("mean") double mean,
            @JsonProperty("stdDev") double stdDev,
            @JsonProperty("median") double median,
            @JsonProperty("p95") double p95,
            @JsonProperty("p99") double p99,
            @JsonProperty("min") double min,
            @JsonProperty("max") double max,
            @JsonProperty("q1") double q1,
            @JsonProperty("q3") double q3,
            @JsonProperty("iqr") double iqr,
            @JsonProperty("mad") double mad) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.median = median;
        this.p95 = p95;
        this.p99 = p99;
        this.min = min;
        this.max = max;
        this.q1 = q1;
        this.q3 = q3;
        this.iqr = iqr;
        this.mad = mad;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link BaselineStats}. Unset fields are zero.
     */
    public static class Builder {
        private double mean;
        private double stdDev;
        private double median;
        private double p95;
        private double p99;
        private double min;
        private double max;
        private double q1;
        private double q3;
        private double iqr;
        private double mad;

        public Builder mean(double mean) {
            this.mean = mean;
            return this;
        }

        public Builder stdDev(double stdDev) {
            this.stdDev = stdDev;
            return this;
        }

        public Builder median(double median) {
            this.median = median;
            return this;
        }

        public Builder p95(double p95) {
            this.p95 = p95;
            return this;
        }

        public Builder p99(double p99) {
            this.p99 = p99;
            return this;
        }

        public Builder min(double min) {
            this.min = min;
            return this;
        }

        public Builder max(double max) {
            this.max = max;
            return this;
        }

        public Builder q1(double q1) {
            this.q1 = q1;
            return this;
        }

        public Builder q3(double q3) {
            this.q3 = q3;
            return this;
        }

        public Builder iqr(double iqr) {
            this.iqr = iqr;
            return this;
        }

        public Builder mad(double mad) {
            this.mad = mad;
            return this;
        }

        public BaselineStats build() {
            return new BaselineStats(mean, stdDev, median, p95, p99, min, max, q1, q3, iqr, mad);
        }
    }

    public double getMean() {
        return mean;
    }

    /** @return population standard deviation */
    public double getStdDev() {
        return stdDev;
    }

    public double getMedian() {
        return median;
    }

    public double getP95() {
        return p95;
    }

    public double getP99() {
        return p99;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /** @return first quartile (25th percentile) */
    public double getQ1() {
        return q1;
    }

    /** @return third quartile (75th percentile) */
    public double getQ3() {
        return q3;
    }

    /** @return interquartile range, {@code q3 - q1} */
    public double getIqr() {
        return iqr;
    }

    /** @return median absolute deviation from the median */
    public double getMad() {
        return mad;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineStats that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && Double.compare(median, that.median) == 0
                && Double.compare(p95, that.p95) == 0
                && Double.compare(p99, that.p99) == 0
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && Double.compare(q1, that.q1) == 0
                && Double.compare(q3, that.q3) == 0
                && Double.compare(iqr, that.iqr) == 0
                && Double.compare(mad, that.mad) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev, median, p95, p99, min, max, q1, q3, iqr, mad);
    }

    @Override
    public String toString() {
        return "BaselineStats{" +
                "mean=" + mean +
                ", stdDev=" + stdDev +
                ", median=" + median +
                ", p95=" + p95 +
                ", p99=" + p99 +
                ", min=" + min +
                ", max=" + max +
                ", q1=" + q1 +
                ", q3=" + q3 +
                ", iqr=" + iqr +
                ", mad=" + mad +
                '}';
    }
}
