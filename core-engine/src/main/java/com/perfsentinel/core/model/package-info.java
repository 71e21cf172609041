/**
 * Domain model classes for Perf Sentinel.
 *
 * <p>
 * This package contains the data containers shared between the detection
 * engine, the batch analyzer and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.perfsentinel.core.model.ChangePoint} and
 * {@link com.perfsentinel.core.model.OutlierResult}: raw detector
 * output</li>
 * <li>{@link com.perfsentinel.core.model.PerformancePoint} and
 * {@link com.perfsentinel.core.model.PerformanceSeries}: input
 * measurements</li>
 * <li>{@link com.perfsentinel.core.model.SeriesAnalysis}: per-series result
 * published downstream</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.model;
