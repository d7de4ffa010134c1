package com.spansentinel.core.reporting;

import com.spansentinel.core.model.Anomaly;
import com.spansentinel.core.model.AnomalySeverity;
import com.spansentinel.core.model.AnomalyStats;
import com.spansentinel.core.model.AnomalyType;
import com.spansentinel.core.model.TimeSeriesPoint;
import com.spansentinel.core.model.TimeWindow;
import com.spansentinel.core.model.TraceAnomalyCount;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summarizes a reporting period's anomalies into an {@link AnomalyStats}.
 *
 * <ul>
 *   <li>Counts per severity and per type, with every tier and type present.</li>
 *   <li>The ten trace names with the most anomalies; ties keep the order in
 *       which the traces were first seen. Blank trace names are ignored.</li>
 *   <li>Anomaly counts per consecutive bucket covering the period.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class AnomalyStatsAggregator {

    static final int TOP_TRACES = 10;
    static final Duration DEFAULT_BUCKET = Duration.ofHours(1);

    private AnomalyStatsAggregator() {
        // utility class, not instantiable
    }

    public static AnomalyStats aggregate(Collection<Anomaly> anomalies, int activeAlerts, TimeWindow period) {
        return aggregate(anomalies, activeAlerts, period, DEFAULT_BUCKET);
    }

    /**
     * @param anomalies    the period's anomalies; must not be {@code null}
     * @param activeAlerts number of currently active alerts, passed through
     * @param period       the reporting window
     * @param bucket       width of each time-series bucket; must be positive
     * @return the summary
     * @throws IllegalArgumentException if {@code bucket} is zero or negative
     */
    public static AnomalyStats aggregate(Collection<Anomaly> anomalies, int activeAlerts,
                                         TimeWindow period, Duration bucket) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        Objects.requireNonNull(period, "period must not be null");
        Objects.requireNonNull(bucket, "bucket must not be null");
        if (bucket.isZero() || bucket.isNegative()) {
            throw new IllegalArgumentException("bucket must be positive, got: " + bucket);
        }

        Map<AnomalySeverity, Integer> bySeverity = new EnumMap<>(AnomalySeverity.class);
        for (AnomalySeverity severity : AnomalySeverity.values()) {
            bySeverity.put(severity, 0);
        }
        Map<AnomalyType, Integer> byType = new EnumMap<>(AnomalyType.class);
        for (AnomalyType type : AnomalyType.values()) {
            byType.put(type, 0);
        }
        Map<String, Integer> traceCounts = new LinkedHashMap<>();

        for (Anomaly anomaly : anomalies) {
            if (anomaly.getSeverity() != null) {
                bySeverity.merge(anomaly.getSeverity(), 1, Integer::sum);
            }
            if (anomaly.getType() != null) {
                byType.merge(anomaly.getType(), 1, Integer::sum);
            }
            String traceName = anomaly.getTraceName();
            if (traceName != null && !traceName.isBlank()) {
                traceCounts.merge(traceName, 1, Integer::sum);
            }
        }

        // List.sort is stable, so equal counts stay in first-seen order.
        List<TraceAnomalyCount> topTraces = new ArrayList<>();
        traceCounts.forEach((name, count) -> topTraces.add(new TraceAnomalyCount(name, count)));
        topTraces.sort(Comparator.comparingInt(TraceAnomalyCount::getCount).reversed());

        return new AnomalyStats(
                period,
                anomalies.size(),
                activeAlerts,
                bySeverity,
                byType,
                topTraces.subList(0, Math.min(TOP_TRACES, topTraces.size())),
                overTime(anomalies, period, bucket));
    }

    /**
     * Buckets are {@code [start + i·bucket, start + (i+1)·bucket)}; the last one
     * is cut at the period end and includes it.
     */
    private static List<TimeSeriesPoint> overTime(Collection<Anomaly> anomalies, TimeWindow period,
                                                  Duration bucket) {
        Instant start = period.getStart();
        Instant end = period.getEnd();
        List<Instant> bucketStarts = new ArrayList<>();
        for (Instant bucketStart = start; bucketStart.isBefore(end); bucketStart = bucketStart.plus(bucket)) {
            bucketStarts.add(bucketStart);
        }

        int[] counts = new int[bucketStarts.size()];
        for (Anomaly anomaly : anomalies) {
            Instant at = anomaly.getDetectedAt();
            if (counts.length == 0 || at == null || at.isBefore(start) || at.isAfter(end)) {
                continue;
            }
            long index = Duration.between(start, at).dividedBy(bucket);
            counts[(int) Math.min(index, counts.length - 1)]++;
        }

        List<TimeSeriesPoint> points = new ArrayList<>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            points.add(new TimeSeriesPoint(bucketStarts.get(i), counts[i]));
        }
        return points;
    }
}
