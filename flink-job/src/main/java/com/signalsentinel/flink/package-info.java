/**
 * Apache Flink streaming job for Signal Sentinel.
 *
 * <p>
 * This package hosts the core alert engine in a Flink pipeline that
 * consumes market snapshots from Kafka, runs one evaluation and dispatch
 * cycle per snapshot, and publishes dispatch results back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.signalsentinel.flink.SignalSentinelJob} — main entry
 * point</li>
 * <li>{@link com.signalsentinel.flink.AlertCycleFunction} — single-instance
 * process function</li>
 * <li>{@link com.signalsentinel.flink.JobConfig} — environment-driven
 * configuration</li>
 * <li>{@link com.signalsentinel.flink.HealthServer} — HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.signalsentinel.flink;
