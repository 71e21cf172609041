/**
 * Per-series composition of the detectors and batch execution over a worker
 * pool.
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.analysis;
