package com.spansentinel.core.detection;

import com.spansentinel.core.model.BaselineStats;
import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionResult;

import java.util.Objects;

import static com.spansentinel.core.detection.DetectorUtils.direction;
import static com.spansentinel.core.detection.DetectorUtils.format;

/**
 * Modified Z-score over the median absolute deviation:
 * {@code score = 0.6745 · |value - median| / MAD}.
 *
 * @since 1.0.0
 */
public class MadDetector implements AnomalyDetector {

    /** Scales MAD to be consistent with the standard deviation of a normal distribution. */
    static final double CONSISTENCY_CONSTANT = 0.6745;

    private final double threshold;

    /**
     * @param threshold modified Z-score that triggers; must be {@code > 0}
     */
    public MadDetector(double threshold) {
        DetectorUtils.requirePositive(threshold, "madThreshold");
        this.threshold = threshold;
    }

    @Override
    public DetectionResult detect(double value, double[] history, BaselineStats stats) {
        Objects.requireNonNull(stats, "BaselineStats must not be null");
        double median = stats.getMedian();

        if (stats.getMad() == 0) {
            return DetectionResult.skipped(threshold, median,
                    "MAD is zero, cannot compute modified Z-score");
        }

        double modifiedZ = CONSISTENCY_CONSTANT * Math.abs(value - median) / stats.getMad();
        boolean anomaly = modifiedZ > threshold;

        String description = anomaly
                ? format("Value %.2f has modified Z-score %.2f %s median (%.2f)",
                        value, modifiedZ, direction(value, median), median)
                : format("Modified Z-score %.2f within threshold %.2f (median %.2f)",
                        modifiedZ, threshold, median);

        return DetectionResult.builder()
                .anomaly(anomaly)
                .score(modifiedZ)
                .threshold(threshold)
                .expected(median)
                .description(description)
                .build();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.MAD;
    }

    public double getThreshold() {
        return threshold;
    }
}
