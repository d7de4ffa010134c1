package com.spansentinel.flink;

import com.spansentinel.core.model.Anomaly;
import com.spansentinel.core.model.DetectionRule;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that runs anomaly detection for the
 * observations of one rule, keyed by rule name.
 *
 * <h3>State Management</h3>
 * <p>
 * Per key, a {@code ValueState<SampleWindow>} holds the rule's history and a
 * {@code ValueState<Long>} the epoch millis of its last alert. Both are
 * snapshotted during Flink checkpoints.
 * </p>
 *
 * <h3>Outputs</h3>
 * <p>
 * Alert notifications are the main output; every anomaly, alerted or not, is
 * emitted to the {@link #ANOMALIES} side output.
 * </p>
 *
 * <h3>Metrics</h3>
 * <p>
 * Custom Flink metrics are registered in {@link #open(Configuration)} and
 * updated on every processed observation.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyProcessFunction
        extends KeyedProcessFunction<String, MetricObservation, AlertNotification> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyProcessFunction.class);

    /** Side output carrying every detected anomaly. */
    public static final OutputTag<Anomaly> ANOMALIES = new OutputTag<Anomaly>("anomalies") {
    };

    /** Rule definitions (serializable config, not runtime state). */
    private final List<DetectionRule> rules;
    private final int maxHistorySamples;

    private transient ValueState<SampleWindow> windowState;
    private transient ValueState<Long> lastAlertState;
    private transient ObservationEvaluator evaluator;
    private transient DetectionMetrics metrics;

    /**
     * @param rules             the detection rules; must not be {@code null} or empty
     * @param maxHistorySamples upper bound on each rule's sample window
     * @throws IllegalArgumentException if {@code rules} is empty
     */
    public AnomalyProcessFunction(List<DetectionRule> rules, int maxHistorySamples) {
        Objects.requireNonNull(rules, "Detection rules list must not be null");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("Detection rules list must not be empty");
        }
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        this.maxHistorySamples = maxHistorySamples;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        windowState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("sample-window", TypeInformation.of(SampleWindow.class)));
        lastAlertState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("last-alert-millis", Types.LONG));

        evaluator = new ObservationEvaluator(rules, maxHistorySamples);
        metrics = new DetectionMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AnomalyProcessFunction opened with {} rule(s)", rules.size());
    }

    @Override
    public void close() {
        LOG.info("AnomalyProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(MetricObservation observation,
            KeyedProcessFunction<String, MetricObservation, AlertNotification>.Context ctx,
            Collector<AlertNotification> out) throws Exception {
        long startNanos = System.nanoTime();
        metrics.incrementObservationsProcessed();

        SampleWindow window = windowState.value();
        if (window == null) {
            window = new SampleWindow();
        }
        Long lastAlertMillis = lastAlertState.value();
        Instant lastAlertAt = lastAlertMillis != null ? Instant.ofEpochMilli(lastAlertMillis) : null;

        try {
            ObservationEvaluator.Evaluation evaluation = evaluator.evaluate(observation, window, lastAlertAt);

            if (evaluation.isEvaluated()) {
                windowState.update(window);
            }
            if (evaluation.getAnomaly() != null) {
                ctx.output(ANOMALIES, evaluation.getAnomaly());
                metrics.incrementAnomaliesDetected();
            }
            if (evaluation.getNotification() != null) {
                out.collect(evaluation.getNotification());
                lastAlertState.update(evaluation.getLastAlertAt().toEpochMilli());
                metrics.incrementAlertsEmitted();
            } else if (evaluation.isAlertSuppressed()) {
                metrics.incrementAlertsSuppressed();
            }
        } catch (IllegalArgumentException e) {
            LOG.warn("Rejected observation for rule [{}]: {}", ctx.getCurrentKey(), e.getMessage());
            metrics.incrementObservationsRejected();
        } catch (RuntimeException e) {
            LOG.error("Evaluation failed for rule [{}] – continuing with next observation",
                    ctx.getCurrentKey(), e);
            metrics.incrementObservationsRejected();
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }
}
