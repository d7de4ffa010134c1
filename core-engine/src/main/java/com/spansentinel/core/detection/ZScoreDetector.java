package com.spansentinel.core.detection;

import com.spansentinel.core.model.BaselineStats;
import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionResult;

import java.util.Objects;

import static com.spansentinel.core.detection.DetectorUtils.direction;
import static com.spansentinel.core.detection.DetectorUtils.format;

/**
 * Flags a value whose distance from the baseline mean exceeds
 * {@code threshold} standard deviations.
 *
 * <p>
 * {@code score = |value - mean| / stdDev}; anomalous when
 * {@code score > threshold}. A zero standard deviation skips the check.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements AnomalyDetector {

    private final double threshold;

    /**
     * @param threshold number of standard deviations that triggers; must be {@code > 0}
     * @throws IllegalArgumentException if {@code threshold} is not positive
     */
    public ZScoreDetector(double threshold) {
        DetectorUtils.requirePositive(threshold, "zscoreThreshold");
        this.threshold = threshold;
    }

    @Override
    public DetectionResult detect(double value, double[] history, BaselineStats stats) {
        Objects.requireNonNull(stats, "BaselineStats must not be null");
        double mean = stats.getMean();

        if (stats.getStdDev() == 0) {
            return DetectionResult.skipped(threshold, mean,
                    "Standard deviation is zero, cannot compute Z-score");
        }

        double zScore = Math.abs(value - mean) / stats.getStdDev();
        boolean anomaly = zScore > threshold;

        String description = anomaly
                ? format("Value %.2f is %.1f standard deviations %s mean (%.2f)",
                        value, zScore, direction(value, mean), mean)
                : format("Value %.2f is %.1f standard deviations from mean (%.2f), threshold %.1f",
                        value, zScore, mean, threshold);

        return DetectionResult.builder()
                .anomaly(anomaly)
                .score(zScore)
                .threshold(threshold)
                .expected(mean)
                .description(description)
                .build();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.Z_SCORE;
    }

    public double getThreshold() {
        return threshold;
    }
}
