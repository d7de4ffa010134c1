package com.spansentinel.core.detection;

import com.spansentinel.core.model.BaselineStats;
import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionResult;

import java.util.Objects;

import static com.spansentinel.core.detection.DetectorUtils.direction;
import static com.spansentinel.core.detection.DetectorUtils.format;

/**
 * Compares a value with the simple average of the most recent
 * {@code windowSize} samples.
 *
 * <p>
 * {@code score = |value - avg| / avg}, a fractional deviation; anomalous
 * when {@code score > deviation}. A negative average gives a negative score,
 * which never fires. When the history is shorter than the window, all of it
 * is used.
 * </p>
 *
 * @since 1.0.0
 */
public class MovingAverageDetector implements AnomalyDetector {

    private final int windowSize;
    private final double deviation;

    /**
     * @param windowSize number of most recent samples to average; must be {@code >= 1}
     * @param deviation  allowed fractional deviation; must be {@code > 0}
     */
    public MovingAverageDetector(int windowSize, double deviation) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        DetectorUtils.requirePositive(deviation, "deviation");
        this.windowSize = windowSize;
        this.deviation = deviation;
    }

    @Override
    public DetectionResult detect(double value, double[] history, BaselineStats stats) {
        Objects.requireNonNull(history, "history must not be null");

        int window = Math.min(windowSize, history.length);
        if (window == 0) {
            return DetectionResult.skipped(deviation, 0, "No historical data for moving average");
        }

        double sum = 0;
        for (int i = history.length - window; i < history.length; i++) {
            sum += history[i];
        }
        double avg = sum / window;

        if (avg == 0) {
            return DetectionResult.skipped(deviation, 0, "Moving average is zero");
        }

        double relative = Math.abs(value - avg) / avg;
        boolean anomaly = relative > deviation;

        String description = anomaly
                ? format("Value %.2f deviates %.1f%% %s moving average (%.2f)",
                        value, relative * 100, direction(value, avg), avg)
                : format("Value %.2f within %.1f%% of moving average (%.2f)",
                        value, deviation * 100, avg);

        return DetectionResult.builder()
                .anomaly(anomaly)
                .score(relative)
                .threshold(deviation)
                .expected(avg)
                .description(description)
                .build();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.MOVING_AVERAGE;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getDeviation() {
        return deviation;
    }
}
