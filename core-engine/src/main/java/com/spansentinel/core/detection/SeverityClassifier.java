package com.spansentinel.core.detection;

import com.spansentinel.core.model.AnomalySeverity;

/**
 * Maps an anomaly score to a severity by its ratio to the trigger threshold.
 *
 * <table>
 *   <caption>ratio = score / |threshold|</caption>
 *   <tr><td>&gt; 3.0</td><td>CRITICAL</td></tr>
 *   <tr><td>&gt; 2.0</td><td>HIGH</td></tr>
 *   <tr><td>&gt; 1.5</td><td>MEDIUM</td></tr>
 *   <tr><td>otherwise</td><td>LOW</td></tr>
 * </table>
 *
 * A zero threshold makes any positive score CRITICAL.
 *
 * @since 1.0.0
 */
public final class SeverityClassifier {

    static final double CRITICAL_RATIO = 3.0;
    static final double HIGH_RATIO = 2.0;
    static final double MEDIUM_RATIO = 1.5;

    private SeverityClassifier() {
        // utility class, not instantiable
    }

    public static AnomalySeverity classify(double score, double threshold) {
        if (threshold == 0) {
            return score > 0 ? AnomalySeverity.CRITICAL : AnomalySeverity.LOW;
        }

        double ratio = score / Math.abs(threshold);
        if (ratio > CRITICAL_RATIO) {
            return AnomalySeverity.CRITICAL;
        }
        if (ratio > HIGH_RATIO) {
            return AnomalySeverity.HIGH;
        }
        if (ratio > MEDIUM_RATIO) {
            return AnomalySeverity.MEDIUM;
        }
        return AnomalySeverity.LOW;
    }
}
