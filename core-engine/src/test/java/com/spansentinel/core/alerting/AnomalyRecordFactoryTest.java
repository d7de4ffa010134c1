package com.spansentinel.core.alerting;

import com.spansentinel.core.model.Alert;
import com.spansentinel.core.model.AlertStatus;
import com.spansentinel.core.model.Anomaly;
import com.spansentinel.core.model.AnomalyContext;
import com.spansentinel.core.model.AnomalySeverity;
import com.spansentinel.core.model.AnomalyType;
import com.spansentinel.core.model.BaselineStats;
import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionResult;
import com.spansentinel.core.model.DetectionRule;
import com.spansentinel.core.model.Identifiers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyRecordFactory}.
 */
class AnomalyRecordFactoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final UUID ANOMALY_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID ALERT_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");
    private static final String TRACE_ID = "6f1c9a52-3d4e-4b8a-9c2f-1e0d7a6b5c43";

    private AnomalyRecordFactory factory;
    private DetectionRule rule;

    @BeforeEach
    void setUp() {
        Iterator<UUID> ids = List.of(ANOMALY_ID, ALERT_ID).iterator();
        factory = new AnomalyRecordFactory(Clock.fixed(NOW, ZoneOffset.UTC), ids::next);

        rule = new DetectionRule();
        rule.setName("checkout-latency");
        rule.setType("latency");
        rule.setMethod("moving_average");
    }

    @Test
    @DisplayName("Should copy result, rule and context into the anomaly")
    void shouldCreateAnomaly() {
        AnomalyContext context = AnomalyContext.builder()
                .traceId(TRACE_ID)
                .traceName("checkout")
                .spanName("db.query")
                .metadata(Map.of("region", "eu"))
                .sampleCount(5)
                .build();

        Anomaly anomaly = factory.createAnomaly(rule, anomalousResult(), context);

        assertThat(anomaly.getId()).isEqualTo(ANOMALY_ID);
        assertThat(anomaly.getRuleId()).isEqualTo(Identifiers.fromName("checkout-latency"));
        assertThat(anomaly.getRuleName()).isEqualTo("checkout-latency");
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.LATENCY);
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(anomaly.getMethod()).isEqualTo(DetectionMethod.MOVING_AVERAGE);
        assertThat(anomaly.getDetectedAt()).isEqualTo(NOW);
        assertThat(anomaly.getValue()).isEqualTo(15.0);
        assertThat(anomaly.getExpected()).isEqualTo(10.0);
        assertThat(anomaly.getScore()).isEqualTo(0.5);
        assertThat(anomaly.getThreshold()).isEqualTo(0.2);
        assertThat(anomaly.getTraceId()).isEqualTo(UUID.fromString(TRACE_ID));
        assertThat(anomaly.getTraceName()).isEqualTo("checkout");
        assertThat(anomaly.getSpanName()).isEqualTo("db.query");
        assertThat(anomaly.getMetadata()).containsEntry("region", "eu");
        assertThat(anomaly.getSampleCount()).isEqualTo(5);
        assertThat(anomaly.getBaselineStats()).isEqualTo(BaselineStats.EMPTY);
        assertThat(anomaly.getAlertsSent()).isEmpty();
    }

    @Test
    @DisplayName("Should use an explicit rule id when configured")
    void shouldUseExplicitRuleId() {
        rule.setId("0b6f3c2a-8d1e-4f5a-9b7c-2d3e4f5a6b7c");

        Anomaly anomaly = factory.createAnomaly(rule, anomalousResult(), null);

        assertThat(anomaly.getRuleId()).isEqualTo(UUID.fromString("0b6f3c2a-8d1e-4f5a-9b7c-2d3e4f5a6b7c"));
        assertThat(anomaly.getTraceId()).isNull();
    }

    @Test
    @DisplayName("Non-anomalous result leaves the severity unset")
    void shouldNotInventSeverity() {
        DetectionResult normal = DetectionResult.skipped(0, 0, "Insufficient samples (5 < 30 required)");

        Anomaly anomaly = factory.createAnomaly(rule, normal, null);

        assertThat(normal.isAnomaly()).isFalse();
        assertThat(anomaly.getSeverity()).isNull();
    }

    @Test
    @DisplayName("Severity is copied from the result unchanged")
    void shouldCopySeverity() {
        DetectionResult result = anomalousResult().toBuilder().severity(AnomalySeverity.LOW).build();

        assertThat(factory.createAnomaly(rule, result, null).getSeverity()).isEqualTo(AnomalySeverity.LOW);
    }

    @Test
    @DisplayName("Malformed trace id is rejected while building the context")
    void shouldRejectMalformedTraceId() {
        assertThatThrownBy(() -> AnomalyContext.builder().traceId("not-a-uuid"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed trace id");
    }

    @Test
    @DisplayName("Should derive an active alert with deviation percentage")
    void shouldCreateAlert() {
        Anomaly anomaly = factory.createAnomaly(rule, anomalousResult(), null);

        Alert alert = factory.createAlert(anomaly, rule);

        assertThat(alert.getId()).isEqualTo(ALERT_ID);
        assertThat(alert.getAnomalyId()).isEqualTo(ANOMALY_ID);
        assertThat(alert.getRuleId()).isEqualTo(anomaly.getRuleId());
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
        assertThat(alert.getSeverity()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(alert.getTitle()).isEqualTo("Latency Anomaly Detected: checkout-latency");
        assertThat(alert.getDescription()).isEqualTo(anomaly.getDescription());
        assertThat(alert.getCurrentValue()).isEqualTo(15.0);
        assertThat(alert.getExpectedValue()).isEqualTo(10.0);
        assertThat(alert.getDeviation()).isCloseTo(50.0, within(1e-9));
        assertThat(alert.getTriggeredAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Zero expected value gives zero deviation")
    void shouldUseZeroDeviationWhenExpectedIsZero() {
        rule.setType("error_rate");
        DetectionResult result = anomalousResult().toBuilder().expected(0).build();

        Alert alert = factory.createAlert(factory.createAnomaly(rule, result, null), rule);

        assertThat(alert.getDeviation()).isZero();
        assertThat(alert.getTitle()).startsWith("Error Rate Anomaly Detected");
    }

    // Helpers

    private static DetectionResult anomalousResult() {
        return DetectionResult.builder()
                .anomaly(true)
                .score(0.5)
                .threshold(0.2)
                .expected(10)
                .value(15)
                .method(DetectionMethod.MOVING_AVERAGE)
                .stats(BaselineStats.EMPTY)
                .severity(AnomalySeverity.HIGH)
                .description("Value 15.00 deviates 50.0% above moving average (10.00)")
                .build();
    }
}
