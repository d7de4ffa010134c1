package com.spansentinel.core.detection;

import com.spansentinel.core.model.BaselineStats;
import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionResult;

import static com.spansentinel.core.detection.DetectorUtils.format;

/**
 * Static bounds check. Either bound may be absent.
 *
 * <p>
 * The minimum is checked before the maximum. The score is the distance past
 * the violated bound relative to that bound, or the raw distance when the
 * bound is zero.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdDetector implements AnomalyDetector {

    private final Double minThreshold;
    private final Double maxThreshold;

    /**
     * @param minThreshold lower bound, or {@code null} for none
     * @param maxThreshold upper bound, or {@code null} for none
     * @throws IllegalArgumentException if both are present and min &gt; max
     */
    public ThresholdDetector(Double minThreshold, Double maxThreshold) {
        if (minThreshold != null && maxThreshold != null && minThreshold > maxThreshold) {
            throw new IllegalArgumentException("minThreshold " + minThreshold
                    + " is greater than maxThreshold " + maxThreshold);
        }
        this.minThreshold = minThreshold;
        this.maxThreshold = maxThreshold;
    }

    @Override
    public DetectionResult detect(double value, double[] history, BaselineStats stats) {
        if (minThreshold != null && value < minThreshold) {
            return violation(value, minThreshold, minThreshold - value,
                    format("Value %.2f below minimum threshold %.2f", value, minThreshold));
        }
        if (maxThreshold != null && value > maxThreshold) {
            return violation(value, maxThreshold, value - maxThreshold,
                    format("Value %.2f above maximum threshold %.2f", value, maxThreshold));
        }

        double threshold = maxThreshold != null ? maxThreshold
                : minThreshold != null ? minThreshold : 0;
        return DetectionResult.builder()
                .anomaly(false)
                .score(0)
                .threshold(threshold)
                .expected(value)
                .description(format("Value %.2f within thresholds [%s, %s]",
                        value, bound(minThreshold, "-inf"), bound(maxThreshold, "+inf")))
                .build();
    }

    private static DetectionResult violation(double value, double bound, double distance,
                                             String description) {
        double score = bound == 0 ? distance : distance / Math.abs(bound);
        return DetectionResult.builder()
                .anomaly(true)
                .score(score)
                .threshold(bound)
                .expected(bound)
                .description(description)
                .build();
    }

    private static String bound(Double bound, String absent) {
        return bound == null ? absent : format("%.2f", bound);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.THRESHOLD;
    }

    public Double getMinThreshold() {
        return minThreshold;
    }

    public Double getMaxThreshold() {
        return maxThreshold;
    }
}
