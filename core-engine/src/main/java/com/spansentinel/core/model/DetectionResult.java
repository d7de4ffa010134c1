package com.spansentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of judging one value with one detection method.
 *
 * <p>
 * Detectors fill in {@code anomaly}, {@code score}, {@code threshold},
 * {@code expected} and {@code description}. The engine then enriches the
 * result with the {@code method}, the observed {@code value}, the
 * {@code stats} used and, for anomalies only, the {@code severity}.
 * </p>
 *
 * <p>
 * {@code score} is method specific: z-scores, IQR units and relative
 * deviations are not comparable with each other. {@code score} and
 * {@code threshold} are always populated, also when detection was skipped.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean anomaly;
    private final double score;
    private final double threshold;
    private final double expected;
    private final String description;

    private final DetectionMethod method;
    private final double value;
    private final BaselineStats stats;
    private final AnomalySeverity severity;

    private DetectionResult(Builder builder) {
        this.anomaly = builder.anomaly;
        this.score = builder.score;
        this.threshold = builder.threshold;
        this.expected = builder.expected;
        this.description = Objects.requireNonNull(builder.description, "description must not be null");
        this.method = builder.method;
        this.value = builder.value;
        this.stats = builder.stats;
        this.severity = builder.severity;
    }

    /**
     * Result for a check that could not be performed (degenerate statistics,
     * no data). Never anomalous.
     *
     * @param threshold   the trigger parameter in force
     * @param expected    the baseline value, if any
     * @param description why the check was skipped
     * @return a non-anomalous result with score 0
     */
    public static DetectionResult skipped(double threshold, double expected, String description) {
        return builder()
                .anomaly(false)
                .score(0)
                .threshold(threshold)
                .expected(expected)
                .description(description)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this result's fields
     */
    public Builder toBuilder() {
        return new Builder()
                .anomaly(anomaly)
                .score(score)
                .threshold(threshold)
                .expected(expected)
                .description(description)
                .method(method)
                .value(value)
                .stats(stats)
                .severity(severity);
    }

    /**
     * Fluent builder for {@link DetectionResult}. {@code description} is
     * required.
     */
    public static class Builder {
        private boolean anomaly;
        private double score;
        private double threshold;
        private double expected;
        private String description;
        private DetectionMethod method;
        private double value;
        private BaselineStats stats;
        private AnomalySeverity severity;

        public Builder anomaly(boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder expected(double expected) {
            this.expected = expected;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder method(DetectionMethod method) {
            this.method = method;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder stats(BaselineStats stats) {
            this.stats = stats;
            return this;
        }

        public Builder severity(AnomalySeverity severity) {
            this.severity = severity;
            return this;
        }

        /**
         * @return a new {@link DetectionResult}
         * @throws NullPointerException if {@code description} is {@code null}
         */
        public DetectionResult build() {
            return new DetectionResult(this);
        }
    }

    @JsonProperty("isAnomaly")
    public boolean isAnomaly() {
        return anomaly;
    }

    public double getScore() {
        return score;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getExpected() {
        return expected;
    }

    public String getDescription() {
        return description;
    }

    /** @return the method that produced the result, {@code null} before enrichment */
    public DetectionMethod getMethod() {
        return method;
    }

    public double getValue() {
        return value;
    }

    /** @return the baseline the value was judged against, may be {@code null} */
    public BaselineStats getStats() {
        return stats;
    }

    /** @return the severity tier, {@code null} unless the result is an anomaly */
    public AnomalySeverity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "anomaly=" + anomaly +
                ", method=" + method +
                ", value=" + value +
                ", score=" + score +
                ", threshold=" + threshold +
                ", expected=" + expected +
                ", severity=" + severity +
                ", description='" + description + '\'' +
                '}';
    }
}
