/**
 * Apache Flink streaming job for Perf Sentinel.
 *
 * <p>
 * Consumes performance results from Kafka, keeps every series in keyed
 * state, analyses a series once its new results have settled, and publishes
 * the analysis back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.perfsentinel.flink.PerfSentinelJob}: main entry point</li>
 * <li>{@link com.perfsentinel.flink.SeriesAnalysisFunction}: keyed process
 * function</li>
 * <li>{@link com.perfsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.perfsentinel.flink.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.perfsentinel.flink;
