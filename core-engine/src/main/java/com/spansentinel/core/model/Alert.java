package com.spansentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Alert raised for an {@link Anomaly} that passed the rule's cooldown.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} to construct instances. The builder enforces that
 * {@code id}, {@code anomalyId} and {@code triggeredAt} are present; omitting
 * any of them will throw a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private UUID id;
    private UUID anomalyId;
    private UUID ruleId;
    private AlertStatus status;
    private AnomalySeverity severity;

    private String title;
    private String description;
    private AnomalyType type;

    // --- Metrics snapshot ---
    private double currentValue;
    private double expectedValue;

    /** Percentage deviation of the current from the expected value. */
    private double deviation;

    // --- Timeline ---
    private Instant triggeredAt;
    private Instant acknowledgedAt;
    private Instant resolvedAt;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.anomalyId = Objects.requireNonNull(builder.anomalyId, "anomalyId must not be null");
        this.ruleId = builder.ruleId;
        this.status = builder.status;
        this.severity = builder.severity;
        this.title = builder.title;
        this.description = builder.description;
        this.type = builder.type;
        this.currentValue = builder.currentValue;
        this.expectedValue = builder.expectedValue;
        this.deviation = builder.deviation;
        this.triggeredAt = Objects.requireNonNull(builder.triggeredAt, "triggeredAt must not be null");
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances. Status defaults to
     * {@link AlertStatus#ACTIVE}.
     */
    public static class Builder {
        private UUID id;
        private UUID anomalyId;
        private UUID ruleId;
        private AlertStatus status = AlertStatus.ACTIVE;
        private AnomalySeverity severity;
        private String title;
        private String description;
        private AnomalyType type;
        private double currentValue;
        private double expectedValue;
        private double deviation;
        private Instant triggeredAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder anomalyId(UUID anomalyId) {
            this.anomalyId = anomalyId;
            return this;
        }

        public Builder ruleId(UUID ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder severity(AnomalySeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder expectedValue(double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder deviation(double deviation) {
            this.deviation = deviation;
            return this;
        }

        public Builder triggeredAt(Instant triggeredAt) {
            this.triggeredAt = triggeredAt;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if {@code id}, {@code anomalyId} or
         *                              {@code triggeredAt} is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
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

    public UUID getAnomalyId() {
        return anomalyId;
    }

    public void setAnomalyId(UUID anomalyId) {
        this.anomalyId = anomalyId;
    }

    public UUID getRuleId() {
        return ruleId;
    }

    public void setRuleId(UUID ruleId) {
        this.ruleId = ruleId;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public void setStatus(AlertStatus status) {
        this.status = status;
    }

    public AnomalySeverity getSeverity() {
        return severity;
    }

    public void setSeverity(AnomalySeverity severity) {
        this.severity = severity;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public AnomalyType getType() {
        return type;
    }

    public void setType(AnomalyType type) {
        this.type = type;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public void setCurrentValue(double currentValue) {
        this.currentValue = currentValue;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public void setExpectedValue(double expectedValue) {
        this.expectedValue = expectedValue;
    }

    public double getDeviation() {
        return deviation;
    }

    public void setDeviation(double deviation) {
        this.deviation = deviation;
    }

    public Instant getTriggeredAt() {
        return triggeredAt;
    }

    public void setTriggeredAt(Instant triggeredAt) {
        this.triggeredAt = triggeredAt;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public void setAcknowledgedAt(Instant acknowledgedAt) {
        this.acknowledgedAt = acknowledgedAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(id, alert.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id=" + id +
                ", anomalyId=" + anomalyId +
                ", status=" + status +
                ", severity=" + severity +
                ", title='" + title + '\'' +
                ", deviation=" + deviation +
                ", triggeredAt=" + triggeredAt +
                '}';
    }
}
