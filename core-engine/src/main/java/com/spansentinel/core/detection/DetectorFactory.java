package com.spansentinel.core.detection;

import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionRule;
import com.spansentinel.core.model.RuleConfig;

import java.util.Objects;

/**
 * Creates the {@link AnomalyDetector} for a rule's method.
 *
 * <p>
 * This is the single point of extension when adding new detection methods:
 * add the constant to {@link DetectionMethod} and a branch here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a detector for the given rule.
     *
     * @param rule the detection rule; must not be {@code null}
     * @return the detector for the rule's method
     * @throws NullPointerException     if {@code rule} or its config is {@code null}
     * @throws IllegalArgumentException if the method is unsupported or its
     *                                  parameters are out of range
     */
    public static AnomalyDetector create(DetectionRule rule) {
        Objects.requireNonNull(rule, "DetectionRule must not be null");
        return create(rule.detectionMethod(), rule.getConfig());
    }

    /**
     * Create a detector for {@code method}, reading only the parameters that
     * method uses from {@code config}.
     */
    public static AnomalyDetector create(DetectionMethod method, RuleConfig config) {
        Objects.requireNonNull(method, "DetectionMethod must not be null");
        Objects.requireNonNull(config, "RuleConfig must not be null");

        return switch (method) {
            case Z_SCORE -> new ZScoreDetector(config.getZscoreThreshold());
            case IQR -> new IqrDetector(config.getIqrMultiplier());
            case MAD -> new MadDetector(config.getMadThreshold());
            case MOVING_AVERAGE -> new MovingAverageDetector(config.getWindowSize(), config.getDeviation());
            case EXPONENTIAL_EMA -> new ExponentialMovingAverageDetector(config.getAlpha(), config.getDeviation());
            case THRESHOLD -> new ThresholdDetector(config.getMinThreshold(), config.getMaxThreshold());
        };
    }
}
