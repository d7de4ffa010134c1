package com.spansentinel.core.reporting;

import com.spansentinel.core.model.Anomaly;
import com.spansentinel.core.model.AnomalySeverity;
import com.spansentinel.core.model.AnomalyStats;
import com.spansentinel.core.model.AnomalyType;
import com.spansentinel.core.model.TimeSeriesPoint;
import com.spansentinel.core.model.TimeWindow;
import com.spansentinel.core.model.TraceAnomalyCount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalyStatsAggregator}.
 */
class AnomalyStatsAggregatorTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");
    private static final TimeWindow PERIOD = new TimeWindow(START, START.plus(Duration.ofHours(3)));

    @Test
    @DisplayName("Should rank traces by anomaly count")
    void shouldRankTraces() {
        List<Anomaly> anomalies = List.of(
                anomaly("B", AnomalySeverity.LOW, AnomalyType.COST, 10),
                anomaly("A", AnomalySeverity.HIGH, AnomalyType.LATENCY, 20),
                anomaly("A", AnomalySeverity.HIGH, AnomalyType.LATENCY, 30),
                anomaly("A", AnomalySeverity.CRITICAL, AnomalyType.LATENCY, 40));

        AnomalyStats stats = AnomalyStatsAggregator.aggregate(anomalies, 2, PERIOD);

        assertThat(stats.getTopAffectedTraces())
                .containsExactly(new TraceAnomalyCount("A", 3), new TraceAnomalyCount("B", 1));
        assertThat(stats.getTotalAnomalies()).isEqualTo(4);
        assertThat(stats.getActiveAlerts()).isEqualTo(2);
        assertThat(stats.getPeriod()).isEqualTo(PERIOD);
    }

    @Test
    @DisplayName("Every severity and type is present, zero when unseen")
    void shouldZeroInitializeCounts() {
        AnomalyStats stats = AnomalyStatsAggregator.aggregate(
                List.of(anomaly("A", AnomalySeverity.HIGH, AnomalyType.TOKENS, 5)), 0, PERIOD);

        assertThat(stats.getBySeverity()).containsOnlyKeys(AnomalySeverity.values());
        assertThat(stats.getBySeverity().get(AnomalySeverity.HIGH)).isEqualTo(1);
        assertThat(stats.getBySeverity().get(AnomalySeverity.LOW)).isZero();
        assertThat(stats.getByType()).containsOnlyKeys(AnomalyType.values());
        assertThat(stats.getByType().get(AnomalyType.TOKENS)).isEqualTo(1);
        assertThat(stats.getByType().get(AnomalyType.COST)).isZero();
    }

    @Test
    @DisplayName("Ties keep first-seen order and blank trace names are ignored")
    void shouldBreakTiesByFirstEncounter() {
        List<Anomaly> anomalies = List.of(
                anomaly("first", AnomalySeverity.LOW, AnomalyType.CUSTOM, 1),
                anomaly(" ", AnomalySeverity.LOW, AnomalyType.CUSTOM, 2),
                anomaly("second", AnomalySeverity.LOW, AnomalyType.CUSTOM, 3),
                anomaly(null, AnomalySeverity.LOW, AnomalyType.CUSTOM, 4));

        AnomalyStats stats = AnomalyStatsAggregator.aggregate(anomalies, 0, PERIOD);

        assertThat(stats.getTopAffectedTraces())
                .extracting(TraceAnomalyCount::getTraceName)
                .containsExactly("first", "second");
        assertThat(stats.getTotalAnomalies()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should keep only the ten most affected traces")
    void shouldLimitTopTraces() {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            anomalies.add(anomaly("trace-" + i, AnomalySeverity.LOW, AnomalyType.LATENCY, i));
        }

        AnomalyStats stats = AnomalyStatsAggregator.aggregate(anomalies, 0, PERIOD);

        assertThat(stats.getTopAffectedTraces()).hasSize(10);
        assertThat(stats.getTopAffectedTraces().get(0).getTraceName()).isEqualTo("trace-0");
    }

    @Test
    @DisplayName("Should bucket anomalies by hour across the period")
    void shouldBucketOverTime() {
        List<Anomaly> anomalies = List.of(
                anomaly("A", AnomalySeverity.LOW, AnomalyType.LATENCY, 10),
                anomaly("A", AnomalySeverity.LOW, AnomalyType.LATENCY, 50),
                anomaly("A", AnomalySeverity.LOW, AnomalyType.LATENCY, 90),
                anomaly("A", AnomalySeverity.LOW, AnomalyType.LATENCY, 180));

        AnomalyStats stats = AnomalyStatsAggregator.aggregate(anomalies, 0, PERIOD);

        assertThat(stats.getAnomaliesOverTime()).containsExactly(
                new TimeSeriesPoint(START, 2),
                new TimeSeriesPoint(START.plus(Duration.ofHours(1)), 1),
                new TimeSeriesPoint(START.plus(Duration.ofHours(2)), 1));
    }

    @Test
    @DisplayName("Empty input yields zero counts")
    void shouldHandleNoAnomalies() {
        AnomalyStats stats = AnomalyStatsAggregator.aggregate(List.of(), 0, PERIOD);

        assertThat(stats.getTotalAnomalies()).isZero();
        assertThat(stats.getTopAffectedTraces()).isEmpty();
        assertThat(stats.getAnomaliesOverTime()).hasSize(3)
                .allSatisfy(point -> assertThat(point.getValue()).isZero());
    }

    @Test
    @DisplayName("Bucket edges: start inclusive, partial last bucket includes the period end")
    void shouldPlaceAnomaliesOnBucketEdges() {
        List<Anomaly> anomalies = List.of(
                anomaly("A", AnomalySeverity.LOW, AnomalyType.LATENCY, 0),
                anomaly("A", AnomalySeverity.LOW, AnomalyType.LATENCY, 49),
                anomaly("A", AnomalySeverity.LOW, AnomalyType.LATENCY, 50),
                anomaly("A", AnomalySeverity.LOW, AnomalyType.LATENCY, 180),
                anomaly("A", AnomalySeverity.LOW, AnomalyType.LATENCY, 200));

        AnomalyStats stats = AnomalyStatsAggregator.aggregate(anomalies, 0, PERIOD, Duration.ofMinutes(50));

        assertThat(stats.getTotalAnomalies()).isEqualTo(5);
        assertThat(stats.getAnomaliesOverTime()).containsExactly(
                new TimeSeriesPoint(START, 2),
                new TimeSeriesPoint(START.plus(Duration.ofMinutes(50)), 1),
                new TimeSeriesPoint(START.plus(Duration.ofMinutes(100)), 0),
                new TimeSeriesPoint(START.plus(Duration.ofMinutes(150)), 1));
    }

    @Test
    @DisplayName("Fine buckets over a long period keep every in-period anomaly")
    void shouldHandleManyBuckets() {
        TimeWindow day = new TimeWindow(START, START.plus(Duration.ofDays(1)));
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < 1_000; i++) {
            anomalies.add(anomaly("A", AnomalySeverity.LOW, AnomalyType.LATENCY, i));
        }

        AnomalyStats stats = AnomalyStatsAggregator.aggregate(anomalies, 0, day, Duration.ofSeconds(1));

        assertThat(stats.getAnomaliesOverTime()).hasSize(86_400);
        assertThat(stats.getAnomaliesOverTime().stream().mapToDouble(TimeSeriesPoint::getValue).sum())
                .isEqualTo(1_000.0);
        assertThat(stats.getAnomaliesOverTime().get(60).getValue()).isEqualTo(1.0);
        assertThat(stats.getAnomaliesOverTime().get(61).getValue()).isZero();
    }

    @Test
    @DisplayName("toString includes the time series")
    void shouldDescribeTimeSeries() {
        AnomalyStats stats = AnomalyStatsAggregator.aggregate(List.of(), 0, PERIOD);

        assertThat(stats.toString()).contains("anomaliesOverTime=[");
    }

    @Test
    @DisplayName("Should reject a non-positive bucket")
    void shouldRejectInvalidBucket() {
        assertThatThrownBy(() -> AnomalyStatsAggregator.aggregate(List.of(), 0, PERIOD, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // Helpers

    private static Anomaly anomaly(String traceName, AnomalySeverity severity, AnomalyType type,
                                   int minutesAfterStart) {
        return Anomaly.builder()
                .id(UUID.randomUUID())
                .ruleId(UUID.randomUUID())
                .detectedAt(START.plus(Duration.ofMinutes(minutesAfterStart)))
                .traceName(traceName)
                .severity(severity)
                .type(type)
                .build();
    }
}
