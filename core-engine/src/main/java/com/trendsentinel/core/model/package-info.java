/**
 * Value types shared by the surrogate, bootstrap and power components.
 *
 * <ul>
 * <li>{@link com.trendsentinel.core.model.TimeSeries}: immutable input
 * series with optional censoring</li>
 * <li>{@link com.trendsentinel.core.model.SurrogateEnsemble}: noise
 * realizations forming an empirical null distribution</li>
 * <li>{@link com.trendsentinel.core.model.SignificanceResult},
 * {@link com.trendsentinel.core.model.BootstrapTestResult},
 * {@link com.trendsentinel.core.model.PowerResult}: analysis outcomes</li>
 * <li>{@link com.trendsentinel.core.model.Note}: structured warnings carried
 * by every outcome</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.model;
