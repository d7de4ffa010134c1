package com.spansentinel.core.detection;

import com.spansentinel.core.model.BaselineStats;
import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionResult;

/**
 * Contract for all detection methods.
 * <p>
 * Implementations are <strong>stateless</strong>: everything they need is
 * either fixed at construction (the method parameters) or passed into
 * {@link #detect(double, double[], BaselineStats)}. A single instance may be
 * shared between threads.
 * </p>
 * <p>
 * Degenerate inputs (zero spread, zero average, no history) never throw;
 * they produce a non-anomalous result whose description says why.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Judge a single value against its history.
     *
     * @param value   the newly observed value
     * @param history the historical samples in arrival order, oldest first
     * @param stats   the baseline summary of {@code history}
     * @return the detection outcome, never {@code null}
     */
    DetectionResult detect(double value, double[] history, BaselineStats stats);

    /**
     * @return the method this detector implements
     */
    DetectionMethod getMethod();
}
