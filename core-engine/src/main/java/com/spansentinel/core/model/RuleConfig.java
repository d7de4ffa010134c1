package com.spansentinel.core.model;

import java.io.Serializable;

/**
 * Method-specific tuning parameters of a {@link DetectionRule}.
 *
 * <p>
 * Only the fields belonging to the rule's active {@link DetectionMethod} are
 * read; the rest are ignored. Defaults match the values recommended for each
 * method.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- z_score ---
    /** Number of standard deviations from the mean that counts as anomalous. */
    private double zscoreThreshold = 3.0;

    // --- iqr ---
    /** Fence multiplier k in {@code [Q1 - k·IQR, Q3 + k·IQR]}. */
    private double iqrMultiplier = 1.5;

    // --- mad ---
    /** Modified Z-score above which a value is anomalous. */
    private double madThreshold = 3.0;

    // --- moving_average / exponential_ema ---
    /** Number of most recent samples averaged by the moving-average method. */
    private int windowSize = 10;

    /** Allowed relative deviation from the average (0.2 = 20%). */
    private double deviation = 0.2;

    /** EMA smoothing factor in (0, 1]. */
    private double alpha = 0.3;

    // --- threshold ---
    private Double minThreshold;
    private Double maxThreshold;

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public double getMadThreshold() {
        return madThreshold;
    }

    public void setMadThreshold(double madThreshold) {
        this.madThreshold = madThreshold;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getDeviation() {
        return deviation;
    }

    public void setDeviation(double deviation) {
        this.deviation = deviation;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    /**
     * @return the static lower bound, or {@code null} when unbounded
     */
    public Double getMinThreshold() {
        return minThreshold;
    }

    public void setMinThreshold(Double minThreshold) {
        this.minThreshold = minThreshold;
    }

    /**
     * @return the static upper bound, or {@code null} when unbounded
     */
    public Double getMaxThreshold() {
        return maxThreshold;
    }

    public void setMaxThreshold(Double maxThreshold) {
        this.maxThreshold = maxThreshold;
    }

    @Override
    public String toString() {
        return "RuleConfig{" +
                "zscoreThreshold=" + zscoreThreshold +
                ", iqrMultiplier=" + iqrMultiplier +
                ", madThreshold=" + madThreshold +
                ", windowSize=" + windowSize +
                ", deviation=" + deviation +
                ", alpha=" + alpha +
                ", minThreshold=" + minThreshold +
                ", maxThreshold=" + maxThreshold +
                '}';
    }
}
