/**
 * Domain model classes for Span Sentinel.
 *
 * <p>
 * This package contains the data objects shared between the detection
 * engine, the alerting helpers and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.spansentinel.core.model.DetectionRule}: rule configuration
 * POJO with its {@link com.spansentinel.core.model.RuleConfig}</li>
 * <li>{@link com.spansentinel.core.model.BaselineStats}: summary of a sample
 * window</li>
 * <li>{@link com.spansentinel.core.model.DetectionResult}: outcome of one
 * detection</li>
 * <li>{@link com.spansentinel.core.model.Anomaly} and
 * {@link com.spansentinel.core.model.Alert}: records handed to storage and
 * delivery</li>
 * <li>{@link com.spansentinel.core.model.AnomalyStats}: per-period
 * summary</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.spansentinel.core.model;
