package com.trendsentinel.core.stats;

import java.util.Objects;

/**
 * Output of a {@link RankStatistic}.
 *
 * @since 1.0.0
 */
public final class RankStatisticResult {

    private final double score;
    private final double variance;
    private final long tieCount;
    private final double tau;

    public RankStatisticResult(double score, double variance, long tieCount, double tau) {
        this.score = score;
        this.variance = variance;
        this.tieCount = tieCount;
        this.tau = tau;
    }

    /** @return the trend score, e.g. Mann-Kendall S */
    public double getScore() {
        return score;
    }

    /** @return variance of the score under independence */
    public double getVariance() {
        return variance;
    }

    /** @return number of tied value pairs */
    public long getTieCount() {
        return tieCount;
    }

    /** @return Kendall's tau */
    public double getTau() {
        return tau;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RankStatisticResult that))
            return false;
        return Double.compare(score, that.score) == 0
                && Double.compare(variance, that.variance) == 0
                && tieCount == that.tieCount
                && Double.compare(tau, that.tau) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, variance, tieCount, tau);
    }

    @Override
    public String toString() {
        return "RankStatisticResult{score=" + score + ", variance=" + variance
                + ", tieCount=" + tieCount + ", tau=" + tau + '}';
    }
}
