/**
 * Change-point and outlier detection over ordered performance series.
 *
 * <p>
 * {@link com.perfsentinel.core.detection.SeriesDetectors} is the entry
 * point. {@link com.perfsentinel.core.detection.EDivisiveSegmenter} finds
 * regime boundaries using the Q statistic computed by
 * {@link com.perfsentinel.core.detection.DistanceEngine};
 * {@link com.perfsentinel.core.detection.GesdOutlierDetector} runs the
 * Generalized ESD test. All detectors are pure functions of their input.
 * </p>
 */
package com.perfsentinel.core.detection;
