/**
 * Detection methods and the engine that applies them.
 *
 * <p>
 * Each {@link com.spansentinel.core.detection.AnomalyDetector} implements one
 * {@link com.spansentinel.core.model.DetectionMethod}.
 * {@link com.spansentinel.core.detection.AnomalyEngine} gates on sample count,
 * computes baseline statistics, dispatches to the detector and classifies
 * severity.
 * </p>
 *
 * @since 1.0.0
 */
package com.spansentinel.core.detection;
