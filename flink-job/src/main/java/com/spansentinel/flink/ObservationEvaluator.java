package com.spansentinel.flink;

import com.spansentinel.core.alerting.AlertMessageFormatter;
import com.spansentinel.core.alerting.AnomalyRecordFactory;
import com.spansentinel.core.alerting.CooldownGate;
import com.spansentinel.core.detection.AnomalyEngine;
import com.spansentinel.core.model.Alert;
import com.spansentinel.core.model.Anomaly;
import com.spansentinel.core.model.AnomalyContext;
import com.spansentinel.core.model.DetectionResult;
import com.spansentinel.core.model.DetectionRule;
import com.spansentinel.core.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Per-observation detection workflow, independent of the Flink runtime.
 *
 * <ol>
 *   <li>Look up the rule by name; skip unknown and disabled rules.</li>
 *   <li>Skip observations that do not match the rule's trace-name and
 *       metadata filters.</li>
 *   <li>Prune the sample window to the rule's lookback and the history
 *       limit, then judge the value against what remains.</li>
 *   <li>Add the value to the window.</li>
 *   <li>On an anomaly, build the {@link Anomaly}; if the cooldown allows,
 *       build the {@link Alert} and its message.</li>
 * </ol>
 *
 * <p>
 * The caller owns the window and the last-alert timestamp. The evaluator
 * mutates the window it is given and reports the new last-alert timestamp in
 * the returned {@link Evaluation}.
 * </p>
 *
 * @since 1.0.0
 */
public class ObservationEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ObservationEvaluator.class);

    private final Map<String, DetectionRule> rulesByName = new LinkedHashMap<>();
    private final int maxHistorySamples;
    private final Clock clock;
    private final AnomalyEngine engine = new AnomalyEngine();
    private final AnomalyRecordFactory recordFactory;
    private final CooldownGate cooldownGate;

    public ObservationEvaluator(List<DetectionRule> rules, int maxHistorySamples) {
        this(rules, maxHistorySamples, Clock.systemUTC(), UUID::randomUUID);
    }

    ObservationEvaluator(List<DetectionRule> rules, int maxHistorySamples,
                         Clock clock, Supplier<UUID> idGenerator) {
        Objects.requireNonNull(rules, "Detection rules list must not be null");
        if (maxHistorySamples < 1) {
            throw new IllegalArgumentException("maxHistorySamples must be >= 1, got: " + maxHistorySamples);
        }
        for (DetectionRule rule : rules) {
            rulesByName.put(rule.getName(), rule);
        }
        this.maxHistorySamples = maxHistorySamples;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.recordFactory = new AnomalyRecordFactory(clock, idGenerator);
        this.cooldownGate = new CooldownGate(clock);
    }

    /**
     * Evaluate one observation.
     *
     * @param observation the measurement; must carry a rule name and value
     * @param window      the rule's history, updated in place
     * @param lastAlertAt when the rule last alerted, or {@code null}
     * @return what happened
     * @throws IllegalArgumentException if the value is missing or not finite,
     *                                  or the trace or span id is malformed;
     *                                  the window is left untouched
     */
    public Evaluation evaluate(MetricObservation observation, SampleWindow window, Instant lastAlertAt) {
        Objects.requireNonNull(observation, "observation must not be null");
        Objects.requireNonNull(window, "window must not be null");

        DetectionRule rule = rulesByName.get(observation.getRuleName());
        if (rule == null) {
            LOG.trace("No rule named '{}' – skipping", observation.getRuleName());
            return Evaluation.skipped(Evaluation.Outcome.UNKNOWN_RULE, lastAlertAt);
        }
        if (!rule.isEnabled()) {
            LOG.trace("Rule [{}] is disabled – skipping", rule.getName());
            return Evaluation.skipped(Evaluation.Outcome.DISABLED, lastAlertAt);
        }
        if (!matchesFilters(rule, observation)) {
            LOG.trace("Rule [{}]: observation does not match filters – skipping", rule.getName());
            return Evaluation.skipped(Evaluation.Outcome.FILTERED, lastAlertAt);
        }

        Double observed = observation.getValue();
        if (observed == null || !Double.isFinite(observed)) {
            throw new IllegalArgumentException(
                    "Rule [" + rule.getName() + "]: observation value must be finite, got: " + observed);
        }

        Instant at = observation.getTimestamp() != null ? observation.getTimestamp() : clock.instant();
        Duration lookback = Duration.ofHours(rule.getLookbackHours());

        AnomalyContext.Builder context = AnomalyContext.builder()
                .traceId(observation.getTraceId())
                .traceName(observation.getTraceName())
                .spanId(observation.getSpanId())
                .spanName(observation.getSpanName())
                .metadata(observation.getMetadata())
                .timeWindow(TimeWindow.endingAt(at, lookback));

        window.prune(at, lookback, maxHistorySamples);
        double[] history = window.values();
        double value = observed;

        DetectionResult result = engine.detect(rule, value, history);
        window.add(at, value);

        if (!result.isAnomaly()) {
            return Evaluation.normal(result, lastAlertAt);
        }

        Anomaly anomaly = recordFactory.createAnomaly(rule, result, context.sampleCount(history.length).build());

        if (!cooldownGate.shouldTrigger(rule, lastAlertAt)) {
            LOG.debug("Rule [{}]: alert suppressed, last alert at {} within {} minute cooldown",
                    rule.getName(), lastAlertAt, rule.getCooldownMinutes());
            return Evaluation.anomaly(result, anomaly, null, lastAlertAt);
        }

        Alert alert = recordFactory.createAlert(anomaly, rule);
        AlertNotification notification = new AlertNotification(
                alert, rule.getName(), AlertMessageFormatter.format(alert, anomaly));
        LOG.info("Alert fired: rule={} severity={} value={}", rule.getName(), alert.getSeverity(), value);
        return Evaluation.anomaly(result, anomaly, notification, alert.getTriggeredAt());
    }

    /**
     * @return {@code true} if {@code observation} passes the rule's trace-name
     *         filter (exact match) and carries every metadata filter entry
     */
    static boolean matchesFilters(DetectionRule rule, MetricObservation observation) {
        String traceFilter = rule.getTraceNameFilter();
        if (traceFilter != null && !traceFilter.isBlank()
                && !traceFilter.equals(observation.getTraceName())) {
            return false;
        }
        Map<String, String> metadata = observation.getMetadata();
        for (Map.Entry<String, String> filter : rule.getMetadataFilters().entrySet()) {
            if (metadata == null || !Objects.equals(filter.getValue(), metadata.get(filter.getKey()))) {
                return false;
            }
        }
        return true;
    }

    public int ruleCount() {
        return rulesByName.size();
    }

    // ---------------------------------------------------------------
    // Result
    // ---------------------------------------------------------------

    /**
     * Outcome of {@link #evaluate(MetricObservation, SampleWindow, Instant)}.
     */
    public static final class Evaluation {

        /** What happened to the observation. */
        public enum Outcome {
            UNKNOWN_RULE,
            DISABLED,
            FILTERED,
            NORMAL,
            ANOMALY
        }

        private final Outcome outcome;
        private final DetectionResult result;
        private final Anomaly anomaly;
        private final AlertNotification notification;
        private final Instant lastAlertAt;

        private Evaluation(Outcome outcome, DetectionResult result, Anomaly anomaly,
                           AlertNotification notification, Instant lastAlertAt) {
            this.outcome = outcome;
            this.result = result;
            this.anomaly = anomaly;
            this.notification = notification;
            this.lastAlertAt = lastAlertAt;
        }

        static Evaluation skipped(Outcome outcome, Instant lastAlertAt) {
            return new Evaluation(outcome, null, null, null, lastAlertAt);
        }

        static Evaluation normal(DetectionResult result, Instant lastAlertAt) {
            return new Evaluation(Outcome.NORMAL, result, null, null, lastAlertAt);
        }

        static Evaluation anomaly(DetectionResult result, Anomaly anomaly,
                                  AlertNotification notification, Instant lastAlertAt) {
            return new Evaluation(Outcome.ANOMALY, result, anomaly, notification, lastAlertAt);
        }

        public Outcome getOutcome() {
            return outcome;
        }

        /** @return {@code true} if the value was judged and added to the window */
        public boolean isEvaluated() {
            return result != null;
        }

        /** @return the detection result, {@code null} when skipped */
        public DetectionResult getResult() {
            return result;
        }

        /** @return the anomaly, {@code null} unless the value was anomalous */
        public Anomaly getAnomaly() {
            return anomaly;
        }

        /** @return the alert to publish, {@code null} if none or suppressed */
        public AlertNotification getNotification() {
            return notification;
        }

        /** @return {@code true} if an anomaly was found but the cooldown held its alert back */
        public boolean isAlertSuppressed() {
            return anomaly != null && notification == null;
        }

        /** @return the rule's last-alert timestamp after this evaluation */
        public Instant getLastAlertAt() {
            return lastAlertAt;
        }
    }
}
