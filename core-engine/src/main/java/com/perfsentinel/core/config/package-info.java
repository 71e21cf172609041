/**
 * Configuration loading and validation for the analysis parameters.
 *
 * <p>
 * Parameters are defined in YAML and loaded by
 * {@link com.perfsentinel.core.config.AnalysisConfigLoader} into an
 * {@link com.perfsentinel.core.config.AnalysisConfig}. Validation runs
 * right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.config;
