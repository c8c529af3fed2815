package com.trendsentinel.core.stats;

import com.trendsentinel.core.model.TimeSeries;

/**
 * Contract for a robust trend-slope estimator such as Sen's slope.
 *
 * <p>
 * Implementations must be pure and return {@link Double#NaN} when no slope
 * can be estimated (e.g. all times equal).
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SlopeEstimator {

    /**
     * @param series the series; rows may be in any order
     * @return slope in value per time unit, or NaN
     */
    double estimate(TimeSeries series);
}
