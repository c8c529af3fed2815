package com.trendsentinel.core.surrogate;

import com.trendsentinel.core.model.CensorKind;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.stats.Ranks;

import java.util.Objects;

/**
 * Carries censoring flags from a template onto its surrogates by rank.
 *
 * <p>
 * The template rows are ordered once by (value, original index). A surrogate
 * value with stable ordinal rank {@code r} takes the flag and kind of the
 * template row at position {@code r} in that order. Since surrogates are
 * permutations of the template's values, every surrogate carries exactly as
 * many censored rows as the template, duplicates included.
 * </p>
 *
 * @since 1.0.0
 */
public final class CensoringPropagator {

    private final boolean[] censoredByRank;
    private final CensorKind[] kindByRank;

    /**
     * @param values   template values the surrogates were generated from
     *                 (imputed, for censored rows)
     * @param censored template censored flags
     * @param kinds    template censoring kinds
     */
    public CensoringPropagator(double[] values, boolean[] censored, CensorKind[] kinds) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(censored, "censored must not be null");
        Objects.requireNonNull(kinds, "kinds must not be null");
        if (censored.length != values.length || kinds.length != values.length) {
            throw new IllegalArgumentException("values, censored and kinds must have equal length");
        }
        int[] order = Ranks.stableOrder(values);
        this.censoredByRank = new boolean[values.length];
        this.kindByRank = new CensorKind[values.length];
        for (int r = 0; r < order.length; r++) {
            censoredByRank[r] = censored[order[r]];
            kindByRank[r] = kinds[order[r]];
        }
    }

    /**
     * @param times       sampling times of the result
     * @param realization surrogate values, same length as the template
     * @return the realization with censoring assigned by rank
     */
    public TimeSeries propagate(double[] times, double[] realization) {
        Objects.requireNonNull(realization, "realization must not be null");
        if (realization.length != censoredByRank.length) {
            throw new IllegalArgumentException("Expected realization of length " + censoredByRank.length
                    + ", got: " + realization.length);
        }
        int[] ranks = Ranks.ordinalRanks(realization);
        boolean[] censored = new boolean[ranks.length];
        CensorKind[] kinds = new CensorKind[ranks.length];
        for (int i = 0; i < ranks.length; i++) {
            censored[i] = censoredByRank[ranks[i]];
            kinds[i] = kindByRank[ranks[i]];
        }
        return TimeSeries.censored(times, realization, censored, kinds);
    }
}
