/**
 * Moving-block bootstrap: an alternative null model for autocorrelated data.
 *
 * <p>
 * {@link com.trendsentinel.core.bootstrap.BlockBootstrap} picks the block
 * length from the autocorrelation function and draws resample indices;
 * {@link com.trendsentinel.core.bootstrap.BlockBootstrapTester} uses them to
 * test the trend score against detrended residuals and to build a percentile
 * interval for the slope.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.bootstrap;
