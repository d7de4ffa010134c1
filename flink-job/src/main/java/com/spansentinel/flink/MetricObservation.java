package com.spansentinel.flink;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One measurement of a rule's metric, as published on the observations
 * topic.
 *
 * <pre>
 * {
 *   "ruleName": "checkout-latency",
 *   "value": 182.4,
 *   "timestamp": "2024-05-01T12:00:00Z",
 *   "traceId": "6f1c9a52-3d4e-4b8a-9c2f-1e0d7a6b5c43",
 *   "traceName": "checkout",
 *   "spanName": "db.query",
 *   "metadata": {"region": "eu"}
 * }
 * </pre>
 *
 * Only {@code ruleName} and {@code value} are required. Trace and span ids
 * are kept as text and parsed when the observation is evaluated.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricObservation implements Serializable {

    private static final long serialVersionUID = 1L;

    private String ruleName;
    private Double value;
    private Instant timestamp;
    private String traceId;
    private String traceName;
    private String spanId;
    private String spanName;
    private Map<String, String> metadata = new LinkedHashMap<>();

    public MetricObservation() {
    }

    public MetricObservation(String ruleName, double value, Instant timestamp) {
        this.ruleName = ruleName;
        this.value = value;
        this.timestamp = timestamp;
    }

    public String getRuleName() {
        return ruleName;
    }

    public void setRuleName(String ruleName) {
        this.ruleName = ruleName;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getTraceName() {
        return traceName;
    }

    public void setTraceName(String traceName) {
        this.traceName = traceName;
    }

    public String getSpanId() {
        return spanId;
    }

    public void setSpanId(String spanId) {
        this.spanId = spanId;
    }

    public String getSpanName() {
        return spanName;
    }

    public void setSpanName(String spanName) {
        this.spanName = spanName;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, String> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricObservation that))
            return false;
        return Objects.equals(ruleName, that.ruleName)
                && Objects.equals(value, that.value)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(traceId, that.traceId)
                && Objects.equals(spanId, that.spanId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, value, timestamp, traceId, spanId);
    }

    @Override
    public String toString() {
        return "MetricObservation{" +
                "ruleName='" + ruleName + '\'' +
                ", value=" + value +
                ", timestamp=" + timestamp +
                ", traceName='" + traceName + '\'' +
                ", spanName='" + spanName + '\'' +
                '}';
    }
}
