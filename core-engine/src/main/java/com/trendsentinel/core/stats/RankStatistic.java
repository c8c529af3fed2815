package com.trendsentinel.core.stats;

import com.trendsentinel.core.model.TimeSeries;

/**
 * Contract for a monotone-trend rank statistic such as Mann-Kendall S.
 *
 * <p>
 * Implementations must be <strong>pure</strong>: the result depends only on
 * the series passed in, and no state is kept between calls. The surrogate
 * and bootstrap testers call the statistic thousands of times on resampled
 * data, possibly from several threads.
 * </p>
 *
 * <p>
 * Censoring is part of the input. An implementation decides how censored
 * comparisons are resolved; the testers only rely on the score being
 * comparable across series of the same length.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RankStatistic {

    /**
     * Compute the statistic for one series.
     *
     * @param series the series; rows may be in any order
     * @return score, variance, tie count and tau
     */
    RankStatisticResult compute(TimeSeries series);

    /**
     * Shortcut for {@code compute(series).getScore()}.
     *
     * @param series the series
     * @return the trend score
     */
    default double score(TimeSeries series) {
        return compute(series).getScore();
    }
}
