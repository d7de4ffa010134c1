package com.spansentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Span Sentinel.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus).
 * The metric reporter is configured in {@code flink-conf.yaml} at cluster
 * level; the job only defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code observations_processed_total}: every observation received</li>
 *   <li>{@code observations_rejected_total}: observations that failed evaluation</li>
 *   <li>{@code anomalies_detected_total}: anomalous values</li>
 *   <li>{@code alerts_emitted_total}: alerts published</li>
 *   <li>{@code alerts_suppressed_total}: alerts held back by the cooldown</li>
 *   <li>{@code processing_latency_ms}: histogram of per-observation latency</li>
 * </ul>
 */
public class DetectionMetrics {

    private final Counter observationsProcessed;
    private final Counter observationsRejected;
    private final Counter anomaliesDetected;
    private final Counter alertsEmitted;
    private final Counter alertsSuppressed;
    private final Histogram processingLatency;

    public DetectionMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("span_sentinel");

        this.observationsProcessed = group.counter("observations_processed_total");
        this.observationsRejected = group.counter("observations_rejected_total");
        this.anomaliesDetected = group.counter("anomalies_detected_total");
        this.alertsEmitted = group.counter("alerts_emitted_total");
        this.alertsSuppressed = group.counter("alerts_suppressed_total");

        // sliding window of the last 350 samples
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementObservationsProcessed() {
        observationsProcessed.inc();
    }

    public void incrementObservationsRejected() {
        observationsRejected.inc();
    }

    public void incrementAnomaliesDetected() {
        anomaliesDetected.inc();
    }

    public void incrementAlertsEmitted() {
        alertsEmitted.inc();
    }

    public void incrementAlertsSuppressed() {
        alertsSuppressed.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
