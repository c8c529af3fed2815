/**
 * Rank statistics, slope estimation and supporting numerics.
 *
 * <p>
 * {@link com.trendsentinel.core.stats.RankStatistic} and
 * {@link com.trendsentinel.core.stats.SlopeEstimator} are the contracts the
 * testers depend on; {@link com.trendsentinel.core.stats.MannKendall} and
 * {@link com.trendsentinel.core.stats.SensSlope} are reference
 * implementations.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.stats;
