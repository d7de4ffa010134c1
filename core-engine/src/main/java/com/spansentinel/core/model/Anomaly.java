package com.spansentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A detected anomaly: one {@link DetectionResult} tied to the rule that
 * produced it and the trace / span it was observed on.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code ruleId} and {@code detectedAt}
 * are required; omitting any of them throws a {@link NullPointerException}
 * at build time.
 * </p>
 *
 * <h3>Mutability</h3>
 * <p>
 * Detection fields are fixed once built. The only later change is delivery
 * bookkeeping through {@link #recordAlertSent(AlertRecord)}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private UUID id;
    private UUID ruleId;
    private String ruleName;
    private AnomalyType type;
    private AnomalySeverity severity;

    // --- Detection details ---
    private Instant detectedAt;
    private DetectionMethod method;
    private double score;
    private double value;
    private double expected;
    private double threshold;
    private String description;

    // --- Context ---
    private UUID traceId;
    private String traceName;
    private UUID spanId;
    private String spanName;
    private Map<String, String> metadata = new LinkedHashMap<>();
    private TimeWindow timeWindow;
    private int sampleCount;
    private BaselineStats baselineStats;

    private List<AlertRecord> alertsSent = new ArrayList<>();

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Anomaly() {
    }

    private Anomaly(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.ruleId = Objects.requireNonNull(builder.ruleId, "ruleId must not be null");
        this.ruleName = builder.ruleName;
        this.type = builder.type;
        this.severity = builder.severity;
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
        this.method = builder.method;
        this.score = builder.score;
        this.value = builder.value;
        this.expected = builder.expected;
        this.threshold = builder.threshold;
        this.description = builder.description;
        this.traceId = builder.traceId;
        this.traceName = builder.traceName;
        this.spanId = builder.spanId;
        this.spanName = builder.spanName;
        this.metadata = builder.metadata != null
                ? new LinkedHashMap<>(builder.metadata)
                : new LinkedHashMap<>();
        this.timeWindow = builder.timeWindow;
        this.sampleCount = builder.sampleCount;
        this.baselineStats = builder.baselineStats;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private UUID id;
        private UUID ruleId;
        private String ruleName;
        private AnomalyType type;
        private AnomalySeverity severity;
        private Instant detectedAt;
        private DetectionMethod method;
        private double score;
        private double value;
        private double expected;
        private double threshold;
        private String description;
        private UUID traceId;
        private String traceName;
        private UUID spanId;
        private String spanName;
        private Map<String, String> metadata;
        private TimeWindow timeWindow;
        private int sampleCount;
        private BaselineStats baselineStats;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder ruleId(UUID ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder severity(AnomalySeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder method(DetectionMethod method) {
            this.method = method;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder expected(double expected) {
            this.expected = expected;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder traceId(UUID traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder traceName(String traceName) {
            this.traceName = traceName;
            return this;
        }

        public Builder spanId(UUID spanId) {
            this.spanId = spanId;
            return this;
        }

        public Builder spanName(String spanName) {
            this.spanName = spanName;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder timeWindow(TimeWindow timeWindow) {
            this.timeWindow = timeWindow;
            return this;
        }

        public Builder sampleCount(int sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public Builder baselineStats(BaselineStats baselineStats) {
            this.baselineStats = baselineStats;
            return this;
        }

        /**
         * @return a new {@link Anomaly} with an empty alert history
         * @throws NullPointerException if {@code id}, {@code ruleId} or
         *                              {@code detectedAt} is {@code null}
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Alert linkage
    // ---------------------------------------------------------------

    /**
     * Append a delivery attempt to this anomaly's alert history.
     *
     * @param record the delivery record; must not be {@code null}
     */
    public void recordAlertSent(AlertRecord record) {
        alertsSent.add(Objects.requireNonNull(record, "AlertRecord must not be null"));
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getRuleId() {
        return ruleId;
    }

    public void setRuleId(UUID ruleId) {
        this.ruleId = ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public void setRuleName(String ruleName) {
        this.ruleName = ruleName;
    }

    public AnomalyType getType() {
        return type;
    }

    public void setType(AnomalyType type) {
        this.type = type;
    }

    public AnomalySeverity getSeverity() {
        return severity;
    }

    public void setSeverity(AnomalySeverity severity) {
        this.severity = severity;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public void setDetectedAt(Instant detectedAt) {
        this.detectedAt = detectedAt;
    }

    public DetectionMethod getMethod() {
        return method;
    }

    public void setMethod(DetectionMethod method) {
        this.method = method;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public double getExpected() {
        return expected;
    }

    public void setExpected(double expected) {
        this.expected = expected;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public UUID getTraceId() {
        return traceId;
    }

    public void setTraceId(UUID traceId) {
        this.traceId = traceId;
    }

    public String getTraceName() {
        return traceName;
    }

    public void setTraceName(String traceName) {
        this.traceName = traceName;
    }

    public UUID getSpanId() {
        return spanId;
    }

    public void setSpanId(UUID spanId) {
        this.spanId = spanId;
    }

    public String getSpanName() {
        return spanName;
    }

    public void setSpanName(String spanName) {
        this.spanName = spanName;
    }

    /**
     * @return unmodifiable view of the metadata
     */
    public Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void setMetadata(Map<String, String> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public TimeWindow getTimeWindow() {
        return timeWindow;
    }

    public void setTimeWindow(TimeWindow timeWindow) {
        this.timeWindow = timeWindow;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public void setSampleCount(int sampleCount) {
        this.sampleCount = sampleCount;
    }

    public BaselineStats getBaselineStats() {
        return baselineStats;
    }

    public void setBaselineStats(BaselineStats baselineStats) {
        this.baselineStats = baselineStats;
    }

    /**
     * @return unmodifiable view of the alert delivery history
     */
    public List<AlertRecord> getAlertsSent() {
        return Collections.unmodifiableList(alertsSent);
    }

    public void setAlertsSent(List<AlertRecord> alertsSent) {
        this.alertsSent = alertsSent != null ? new ArrayList<>(alertsSent) : new ArrayList<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly anomaly))
            return false;
        return Objects.equals(id, anomaly.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "id=" + id +
                ", ruleName='" + ruleName + '\'' +
                ", type=" + type +
                ", severity=" + severity +
                ", method=" + method +
                ", value=" + value +
                ", expected=" + expected +
                ", score=" + score +
                ", detectedAt=" + detectedAt +
                ", traceName='" + traceName + '\'' +
                '}';
    }
}
