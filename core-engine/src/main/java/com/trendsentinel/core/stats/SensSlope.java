package com.trendsentinel.core.stats;

import com.trendsentinel.core.config.CensoringConfig;
import com.trendsentinel.core.model.CensorKind;
import com.trendsentinel.core.model.TimeSeries;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Objects;

/**
 * Reference Sen's slope: the median of all pairwise slopes.
 *
 * <p>
 * Censored values enter through their detection limits scaled by the
 * configured multipliers ({@code <5} becomes {@code 5 × left}). Pairs whose
 * ordering is ambiguous under censoring are dropped, as are pairs with equal
 * times.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensSlope implements SlopeEstimator {

    private final CensoringConfig censoring;

    /** Largest pairwise-slope buffer the JVM can allocate. */
    static final long MAX_PAIRS = Integer.MAX_VALUE - 8;

    public SensSlope() {
        this(CensoringConfig.defaults());
    }

    public SensSlope(CensoringConfig censoring) {
        this.censoring = Objects.requireNonNull(censoring, "censoring must not be null");
    }

    @Override
    public double estimate(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        int n = series.size();
        double[] t = series.times();
        double[] x = series.values();
        CensorKind[] kinds = series.kinds();
        boolean censored = series.hasCensoring();

        double[] imputed = censored ? censoring.impute(series) : x;

        long pairs = pairCount(n);
        if (pairs > MAX_PAIRS) {
            throw new IllegalArgumentException("Sen's slope over " + n + " observations needs " + pairs
                    + " pairwise slopes, more than an array can hold (" + MAX_PAIRS
                    + "); aggregate the series first");
        }
        double[] slopes = new double[(int) pairs];
        int count = 0;
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                double dt = t[j] - t[i];
                if (dt == 0) {
                    continue;
                }
                if (censored && (kinds[i] != CensorKind.NONE || kinds[j] != CensorKind.NONE)
                        && CensoredComparison.compare(x[i], kinds[i], x[j], kinds[j]) == 0) {
                    continue;
                }
                double slope = (imputed[j] - imputed[i]) / dt;
                if (!Double.isNaN(slope)) {
                    slopes[count++] = slope;
                }
            }
        }
        if (count == 0) {
            return Double.NaN;
        }
        return new Median().evaluate(slopes, 0, count);
    }

    static long pairCount(int n) {
        return n < 2 ? 0 : (long) n * (n - 1) / 2;
    }
}
