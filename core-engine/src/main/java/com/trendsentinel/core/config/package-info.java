/**
 * Configuration loading and validation for trend analyses.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.trendsentinel.core.config.ConfigLoader} into an
 * {@link com.trendsentinel.core.config.AnalysisConfig}. Validation runs right
 * after parsing and reports every problem at once; each section then converts
 * to the immutable typed settings the testers take, such as
 * {@link com.trendsentinel.core.config.IaaftConfig} and
 * {@link com.trendsentinel.core.config.PowerConfig}.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.config;
