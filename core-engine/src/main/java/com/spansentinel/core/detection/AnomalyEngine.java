package com.spansentinel.core.detection;

import com.spansentinel.core.model.AnomalySeverity;
import com.spansentinel.core.model.BaselineStats;
import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionResult;
import com.spansentinel.core.model.DetectionRule;
import com.spansentinel.core.stats.BaselineStatsCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Evaluates one value against its history under a rule.
 *
 * <p>
 * Steps:
 * </p>
 * <ol>
 *   <li>Resolve the rule's method; an unsupported method is an error.</li>
 *   <li>With fewer than {@code minSamples} samples, return a non-anomalous
 *       result without computing statistics.</li>
 *   <li>Compute {@link BaselineStats} and run the method's detector.</li>
 *   <li>Attach method, value and stats; classify severity when anomalous.</li>
 * </ol>
 *
 * <p>
 * The engine holds no state and is safe to share.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEngine.class);

    /**
     * @param rule    the rule to evaluate under; must not be {@code null}
     * @param value   the newly observed value
     * @param history historical samples, oldest first; must not be {@code null}
     * @return the enriched detection result
     * @throws IllegalArgumentException if the rule's method is unsupported or
     *                                  its parameters are out of range
     */
    public DetectionResult detect(DetectionRule rule, double value, double[] history) {
        Objects.requireNonNull(rule, "DetectionRule must not be null");
        Objects.requireNonNull(history, "history must not be null");

        DetectionMethod method = rule.detectionMethod();

        if (history.length < rule.getMinSamples()) {
            LOG.trace("Rule [{}]: {} sample(s), {} required – skipping",
                    rule.getName(), history.length, rule.getMinSamples());
            return DetectionResult.skipped(0, 0,
                            String.format(Locale.ROOT, "Insufficient samples (%d < %d required)",
                                    history.length, rule.getMinSamples()))
                    .toBuilder()
                    .method(method)
                    .value(value)
                    .build();
        }

        BaselineStats stats = BaselineStatsCalculator.calculate(history);
        AnomalyDetector detector = DetectorFactory.create(method, rule.getConfig());
        DetectionResult raw = detector.detect(value, history, stats);

        DetectionResult.Builder enriched = raw.toBuilder()
                .method(method)
                .value(value)
                .stats(stats);

        if (raw.isAnomaly()) {
            AnomalySeverity severity = SeverityClassifier.classify(raw.getScore(), raw.getThreshold());
            enriched.severity(severity);
            LOG.debug("Rule [{}] fired: method={} value={} score={} threshold={} severity={}",
                    rule.getName(), method, value, raw.getScore(), raw.getThreshold(), severity);
        }
        return enriched.build();
    }

    /**
     * Convenience overload for boxed histories.
     *
     * @see #detect(DetectionRule, double, double[])
     */
    public DetectionResult detect(DetectionRule rule, double value, List<Double> history) {
        Objects.requireNonNull(history, "history must not be null");
        double[] samples = new double[history.size()];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = history.get(i);
        }
        return detect(rule, value, samples);
    }
}
