/**
 * Apache Flink streaming job for Span Sentinel.
 *
 * <p>
 * This package wires the core detection engine into a Flink pipeline that
 * consumes metric observations from Kafka, keeps a sample window per rule,
 * runs anomaly detection, and publishes anomalies and alert notifications
 * back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.spansentinel.flink.SpanSentinelJob}: main entry point</li>
 * <li>{@link com.spansentinel.flink.AnomalyProcessFunction}: keyed process
 * function</li>
 * <li>{@link com.spansentinel.flink.ObservationEvaluator}: per-observation
 * detection workflow</li>
 * <li>{@link com.spansentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.spansentinel.flink.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.spansentinel.flink;
