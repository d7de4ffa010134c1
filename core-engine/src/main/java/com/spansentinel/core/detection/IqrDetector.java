package com.spansentinel.core.detection;

import com.spansentinel.core.model.BaselineStats;
import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionResult;

import java.util.Objects;

import static com.spansentinel.core.detection.DetectorUtils.format;

/**
 * Tukey fences: flags a value outside
 * {@code [q1 - k·iqr, q3 + k·iqr]}.
 *
 * <p>
 * The score is the distance beyond the violated fence in units of IQR. When
 * the IQR is zero the raw distance is used instead, so a value outside a
 * collapsed range is still reported.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrDetector implements AnomalyDetector {

    private final double multiplier;

    /**
     * @param multiplier fence multiplier {@code k}; must be {@code >= 0}
     * @throws IllegalArgumentException if {@code multiplier} is negative
     */
    public IqrDetector(double multiplier) {
        if (!(multiplier >= 0)) {
            throw new IllegalArgumentException("iqrMultiplier must be >= 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    @Override
    public DetectionResult detect(double value, double[] history, BaselineStats stats) {
        Objects.requireNonNull(stats, "BaselineStats must not be null");
        double iqr = stats.getIqr();
        double lower = stats.getQ1() - multiplier * iqr;
        double upper = stats.getQ3() + multiplier * iqr;

        double distance = 0;
        if (value < lower) {
            distance = lower - value;
        } else if (value > upper) {
            distance = value - upper;
        }

        boolean anomaly = distance > 0;
        double score = !anomaly ? 0 : (iqr > 0 ? distance / iqr : distance);

        String description = anomaly
                ? format("Value %.2f is %s IQR bounds [%.2f, %.2f]",
                        value, value < lower ? "below" : "above", lower, upper)
                : format("Value %.2f within IQR bounds [%.2f, %.2f]", value, lower, upper);

        return DetectionResult.builder()
                .anomaly(anomaly)
                .score(score)
                .threshold(multiplier)
                .expected(stats.getMedian())
                .description(description)
                .build();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.IQR;
    }

    public double getMultiplier() {
        return multiplier;
    }
}
