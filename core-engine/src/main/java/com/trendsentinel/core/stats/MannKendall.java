package com.trendsentinel.core.stats;

import com.trendsentinel.core.model.CensorKind;
import com.trendsentinel.core.model.TimeSeries;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reference Mann-Kendall rank statistic with censoring support.
 *
 * <p>
 * S is the sum over all pairs of {@code sign(Δt) · sign(Δx)}. Pairs with
 * equal times contribute nothing, so rows may be supplied in any order.
 * Censored comparisons follow {@link CensoredComparison}: a pair counts only
 * when its ordering is certain.
 * </p>
 *
 * <p>
 * The variance is the usual {@code n(n-1)(2n+5)/18} with the correction for
 * groups of tied values, where a tie group is a set of rows sharing both
 * value and censoring kind. Complexity is O(n²).
 * </p>
 *
 * @since 1.0.0
 */
public final class MannKendall implements RankStatistic {

    /** Kendall's tau variant. */
    public enum TauMethod {
        /** {@code S / (n(n-1)/2)}. */
        A,
        /** Tie-adjusted denominator. */
        B
    }

    private final TauMethod tauMethod;

    public MannKendall() {
        this(TauMethod.B);
    }

    public MannKendall(TauMethod tauMethod) {
        this.tauMethod = Objects.requireNonNull(tauMethod, "tauMethod must not be null");
    }

    @Override
    public RankStatisticResult compute(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        int n = series.size();
        double[] t = series.times();
        double[] x = series.values();
        CensorKind[] kinds = series.kinds();

        long score = 0;
        long timeTies = 0;
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                int dt = Double.compare(t[j], t[i]);
                if (dt == 0) {
                    timeTies++;
                    continue;
                }
                int dx = CensoredComparison.compare(x[i], kinds[i], x[j], kinds[j]);
                score += (long) Integer.signum(dt) * dx;
            }
        }

        Map<TieKey, Integer> groups = new HashMap<>();
        for (int i = 0; i < n; i++) {
            groups.merge(new TieKey(x[i], kinds[i]), 1, Integer::sum);
        }
        double tieCorrection = 0;
        long valueTies = 0;
        for (int size : groups.values()) {
            if (size > 1) {
                tieCorrection += (double) size * (size - 1) * (2.0 * size + 5);
                valueTies += (long) size * (size - 1) / 2;
            }
        }
        double variance = ((double) n * (n - 1) * (2.0 * n + 5) - tieCorrection) / 18.0;

        double pairs = n * (n - 1) / 2.0;
        double denominator = switch (tauMethod) {
            case A -> pairs;
            case B -> Math.sqrt((pairs - valueTies) * (pairs - timeTies));
        };
        double tau = denominator > 0 ? score / denominator : 0.0;

        return new RankStatisticResult(score, variance, valueTies, tau);
    }

    @Override
    public String toString() {
        return "MannKendall{tau=" + tauMethod + '}';
    }

    private static final class TieKey {
        private final long bits;
        private final CensorKind kind;

        TieKey(double value, CensorKind kind) {
            // normalise -0.0 so that it ties with 0.0
            this.bits = Double.doubleToLongBits(value == 0.0 ? 0.0 : value);
            this.kind = kind;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof TieKey that))
                return false;
            return bits == that.bits && kind == that.kind;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(bits) * 31 + kind.hashCode();
        }
    }
}
