package com.spansentinel.core.detection;

import com.spansentinel.core.model.BaselineStats;
import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionResult;

import java.util.Objects;

import static com.spansentinel.core.detection.DetectorUtils.direction;
import static com.spansentinel.core.detection.DetectorUtils.format;

/**
 * Compares a value with an exponential moving average of the whole history.
 *
 * <p>
 * The EMA is seeded with the oldest sample and folded forward with
 * {@code ema = alpha·x + (1 - alpha)·ema}. Scoring is the same fractional
 * deviation as {@link MovingAverageDetector}.
 * </p>
 *
 * @since 1.0.0
 */
public class ExponentialMovingAverageDetector implements AnomalyDetector {

    private final double alpha;
    private final double deviation;

    /**
     * @param alpha     smoothing factor in {@code (0, 1]}
     * @param deviation allowed fractional deviation; must be {@code > 0}
     */
    public ExponentialMovingAverageDetector(double alpha, double deviation) {
        if (!(alpha > 0 && alpha <= 1)) {
            throw new IllegalArgumentException("alpha must be in (0, 1], got: " + alpha);
        }
        DetectorUtils.requirePositive(deviation, "deviation");
        this.alpha = alpha;
        this.deviation = deviation;
    }

    @Override
    public DetectionResult detect(double value, double[] history, BaselineStats stats) {
        Objects.requireNonNull(history, "history must not be null");

        if (history.length == 0) {
            return DetectionResult.skipped(deviation, 0, "No historical data for EMA");
        }

        double ema = history[0];
        for (int i = 1; i < history.length; i++) {
            ema = alpha * history[i] + (1 - alpha) * ema;
        }

        if (ema == 0) {
            return DetectionResult.skipped(deviation, 0, "EMA is zero");
        }

        double relative = Math.abs(value - ema) / ema;
        boolean anomaly = relative > deviation;

        String description = anomaly
                ? format("Value %.2f deviates %.1f%% %s EMA (%.2f)",
                        value, relative * 100, direction(value, ema), ema)
                : format("Value %.2f within %.1f%% of EMA (%.2f)", value, deviation * 100, ema);

        return DetectionResult.builder()
                .anomaly(anomaly)
                .score(relative)
                .threshold(deviation)
                .expected(ema)
                .description(description)
                .build();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.EXPONENTIAL_EMA;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getDeviation() {
        return deviation;
    }
}
