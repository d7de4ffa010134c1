package com.spansentinel.core.alerting;

import com.spansentinel.core.model.Alert;
import com.spansentinel.core.model.AlertStatus;
import com.spansentinel.core.model.Anomaly;
import com.spansentinel.core.model.AnomalyContext;
import com.spansentinel.core.model.AnomalySeverity;
import com.spansentinel.core.model.AnomalyType;
import com.spansentinel.core.model.DetectionResult;
import com.spansentinel.core.model.DetectionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns detection results into {@link Anomaly} records and anomalies into
 * {@link Alert} records.
 *
 * <p>
 * Identifiers come from the injected supplier and timestamps from the
 * injected {@link Clock}, so both are deterministic under test.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyRecordFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyRecordFactory.class);

    private final Clock clock;
    private final Supplier<UUID> idGenerator;

    /**
     * Factory on the system UTC clock with random UUIDs.
     */
    public AnomalyRecordFactory() {
        this(Clock.systemUTC(), UUID::randomUUID);
    }

    public AnomalyRecordFactory(Clock clock, Supplier<UUID> idGenerator) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    /**
     * Build the anomaly record for a detection.
     *
     * @param rule    the rule that produced {@code result}
     * @param result  the detection outcome, normally anomalous; its severity
     *                is copied as-is, so a non-anomalous result leaves it unset
     * @param context where the value was observed; {@code null} for none
     * @return a new anomaly with an empty alert history
     * @throws IllegalArgumentException if the rule's id or type is malformed
     */
    public Anomaly createAnomaly(DetectionRule rule, DetectionResult result, AnomalyContext context) {
        Objects.requireNonNull(rule, "DetectionRule must not be null");
        Objects.requireNonNull(result, "DetectionResult must not be null");
        AnomalyContext ctx = context != null ? context : AnomalyContext.builder().build();

        AnomalySeverity severity = result.getSeverity();

        Anomaly anomaly = Anomaly.builder()
                .id(idGenerator.get())
                .ruleId(rule.ruleId())
                .ruleName(rule.getName())
                .type(rule.anomalyType())
                .severity(severity)
                .detectedAt(clock.instant())
                .method(result.getMethod() != null ? result.getMethod() : rule.detectionMethod())
                .score(result.getScore())
                .value(result.getValue())
                .expected(result.getExpected())
                .threshold(result.getThreshold())
                .description(result.getDescription())
                .traceId(ctx.getTraceId())
                .traceName(ctx.getTraceName())
                .spanId(ctx.getSpanId())
                .spanName(ctx.getSpanName())
                .metadata(ctx.getMetadata())
                .timeWindow(ctx.getTimeWindow())
                .sampleCount(ctx.getSampleCount())
                .baselineStats(result.getStats())
                .build();

        LOG.debug("Created anomaly {} for rule [{}] severity={}",
                anomaly.getId(), rule.getName(), severity);
        return anomaly;
    }

    /**
     * Build the active alert for an anomaly.
     *
     * <p>
     * The deviation is {@code (value - expected) / expected × 100}, or
     * {@code 0} when the expected value is zero.
     * </p>
     */
    public Alert createAlert(Anomaly anomaly, DetectionRule rule) {
        Objects.requireNonNull(anomaly, "Anomaly must not be null");
        Objects.requireNonNull(rule, "DetectionRule must not be null");

        double deviation = 0;
        if (anomaly.getExpected() != 0) {
            deviation = (anomaly.getValue() - anomaly.getExpected()) / anomaly.getExpected() * 100;
        }

        AnomalyType type = anomaly.getType() != null ? anomaly.getType() : rule.anomalyType();

        return Alert.builder()
                .id(idGenerator.get())
                .anomalyId(anomaly.getId())
                .ruleId(anomaly.getRuleId())
                .status(AlertStatus.ACTIVE)
                .severity(anomaly.getSeverity())
                .title(type.getDisplayName() + " Anomaly Detected: " + rule.getName())
                .description(anomaly.getDescription())
                .type(type)
                .currentValue(anomaly.getValue())
                .expectedValue(anomaly.getExpected())
                .deviation(deviation)
                .triggeredAt(clock.instant())
                .build();
    }
}
