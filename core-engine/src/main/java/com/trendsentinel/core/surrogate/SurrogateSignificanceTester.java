package com.trendsentinel.core.surrogate;

import com.trendsentinel.core.config.CensoringConfig;
import com.trendsentinel.core.config.IaaftConfig;
import com.trendsentinel.core.config.SpectralConfig;
import com.trendsentinel.core.exception.MissingCapabilityException;
import com.trendsentinel.core.exception.NumericalException;
import com.trendsentinel.core.model.Note;
import com.trendsentinel.core.model.NoteCode;
import com.trendsentinel.core.model.SignificanceResult;
import com.trendsentinel.core.model.SurrogateEnsemble;
import com.trendsentinel.core.model.SurrogateMethod;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.random.SeedSequence;
import com.trendsentinel.core.spectral.PeriodogramProvider;
import com.trendsentinel.core.stats.MannKendall;
import com.trendsentinel.core.stats.RankStatistic;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tests whether a monotone trend score stands out from colored noise with
 * the same spectrum and amplitude distribution.
 *
 * <h3>Procedure</h3>
 * <ol>
 * <li>Sort the rows chronologically and pick the surrogate method: IAAFT for
 * uniform sampling, spectral synthesis for irregular sampling when a
 * {@link PeriodogramProvider} is configured.</li>
 * <li>Impute censored values (limit &times; multiplier) to get a numeric
 * template and generate the surrogate ensemble from it.</li>
 * <li>Score the observed series as given (censoring-aware) and each surrogate
 * with censoring carried over by rank.</li>
 * <li>{@code p = (1 + #{|s_i| >= |s_obs|}) / (1 + N)}; the z-score uses the
 * sample standard deviation of the surrogate scores.</li>
 * </ol>
 *
 * <p>
 * Every degraded path (method fallback, IAAFT on irregular sampling,
 * imputation that moves the score, constant input) is reported as a
 * {@link Note} on the result and logged at WARN.
 * </p>
 *
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class SurrogateSignificanceTester {

    private static final Logger LOG = LoggerFactory.getLogger(SurrogateSignificanceTester.class);

    private final RankStatistic rankStatistic;
    private final PeriodogramProvider periodogramProvider;
    private final IaaftConfig iaaftConfig;
    private final SpectralConfig spectralConfig;
    private final CensoringConfig censoringConfig;
    private final boolean retainEnsemble;

    private SurrogateSignificanceTester(Builder b) {
        this.rankStatistic = b.rankStatistic;
        this.periodogramProvider = b.periodogramProvider;
        this.iaaftConfig = b.iaaftConfig;
        this.spectralConfig = b.spectralConfig;
        this.censoringConfig = b.censoringConfig;
        this.retainEnsemble = b.retainEnsemble;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Run the test with a fresh random seed.
     */
    public SignificanceResult test(TimeSeries series, SurrogateMethod method, int nSurrogates) {
        return test(series, null, method, nSurrogates, SeedSequence.random().root());
    }

    /**
     * Run the test with unit observation weights.
     *
     * @see #test(TimeSeries, double[], SurrogateMethod, int, long)
     */
    public SignificanceResult test(TimeSeries series, SurrogateMethod method, int nSurrogates, long seed) {
        return test(series, null, method, nSurrogates, seed);
    }

    /**
     * Run the surrogate significance test.
     *
     * @param series      observed series, at least two rows
     * @param dy          per-row measurement uncertainty for the periodogram,
     *                    or {@code null}
     * @param method      requested surrogate method
     * @param nSurrogates ensemble size, {@code > 0}
     * @param seed        ensemble seed; equal seeds give identical results
     * @return the test result
     * @throws IllegalArgumentException   if {@code nSurrogates <= 0} or the
     *                                    series has fewer than two rows
     * @throws MissingCapabilityException if {@code SPECTRAL} is requested
     *                                    without a provider and fallback is
     *                                    disabled
     * @throws NumericalException         if any value is NaN or infinite
     */
    public SignificanceResult test(TimeSeries series, double[] dy, SurrogateMethod method,
                                   int nSurrogates, long seed) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(method, "method must not be null");
        if (nSurrogates <= 0) {
            throw new IllegalArgumentException("nSurrogates must be > 0, got: " + nSurrogates);
        }
        if (series.size() < 2) {
            throw new IllegalArgumentException("series must have at least 2 observations, got: " + series.size());
        }
        if (dy != null && dy.length != series.size()) {
            throw new IllegalArgumentException("dy must have one entry per row, got: " + dy.length);
        }
        double[] raw = series.values();
        for (int i = 0; i < raw.length; i++) {
            if (!Double.isFinite(raw[i])) {
                throw new NumericalException("Value at row " + i + " is not finite (" + raw[i]
                        + "); remove or fill missing observations before testing");
            }
        }

        int[] order = series.chronologicalOrder();
        TimeSeries sorted = series.select(order);
        double[] sortedDy = dy == null ? null : select(dy, order);
        double[] times = sorted.times();

        List<Note> notes = new ArrayList<>();
        SurrogateMethod resolved = resolveMethod(method, times, notes);

        double observed = rankStatistic.score(sorted);
        double[] template = sorted.hasCensoring() ? censoringConfig.impute(sorted) : sorted.values();

        if (StatUtils.min(template) == StatUtils.max(template)) {
            String message = "Input values are constant; no trend can be tested";
            LOG.warn(message);
            return SignificanceResult.builder()
                    .method(resolved)
                    .originalScore(0.0)
                    .surrogateScores(new double[nSurrogates])
                    .pValue(1.0)
                    .zScore(0.0)
                    .nSurrogates(nSurrogates)
                    .notes(notes)
                    .note(Note.of(NoteCode.CONSTANT_INPUT, message))
                    .build();
        }

        CensoringPropagator propagator = null;
        if (sorted.hasCensoring()) {
            propagator = new CensoringPropagator(template, sorted.censoredFlags(), sorted.kinds());
            notes.add(Note.of(NoteCode.CENSORED_SURROGATES, sorted.censoredCount()
                    + " censored value(s) imputed for synthesis; censoring propagated to surrogates by rank"));
            double imputedScore = rankStatistic.score(sorted.withUncensoredValues(template));
            if (imputedScore != observed) {
                String message = "Imputing censored values changes the score from " + observed
                        + " to " + imputedScore + "; surrogates are built from the imputed values";
                LOG.warn(message);
                notes.add(Note.of(NoteCode.IMPUTATION_CHANGED_STATISTIC, message));
            }
        }

        SurrogateEnsemble ensemble = generatorFor(resolved).generate(times, template, sortedDy, nSurrogates, seed);
        notes.addAll(ensemble.getNotes());

        double[] scores = new double[ensemble.size()];
        for (int i = 0; i < scores.length; i++) {
            double[] realization = ensemble.getRealization(i);
            TimeSeries surrogate = propagator != null
                    ? propagator.propagate(times, realization)
                    : sorted.withUncensoredValues(realization);
            scores[i] = rankStatistic.score(surrogate);
        }

        double pValue = pValue(observed, scores);
        double zScore = zScore(observed, scores);
        LOG.debug("Surrogate test: method={}, S={}, p={}, z={}", resolved, observed, pValue, zScore);

        return SignificanceResult.builder()
                .method(resolved)
                .originalScore(observed)
                .surrogateScores(scores)
                .pValue(pValue)
                .zScore(zScore)
                .nSurrogates(nSurrogates)
                .notes(notes)
                .ensemble(retainEnsemble ? ensemble.withScores(scores) : null)
                .build();
    }

    /**
     * Resolve the requested method against the sampling and the available
     * capabilities, appending a note for every degraded choice.
     *
     * @param requested requested method
     * @param times     chronological sampling times
     * @param notes     receives fallback notes
     * @return {@code IAAFT} or {@code SPECTRAL}
     * @throws MissingCapabilityException if {@code SPECTRAL} is requested
     *                                    without a provider and fallback is
     *                                    disabled
     */
    public SurrogateMethod resolveMethod(SurrogateMethod requested, double[] times, List<Note> notes) {
        boolean uniform = SamplingInspector.isUniform(times);
        boolean hasProvider = periodogramProvider != null;
        SurrogateMethod resolved;
        switch (requested) {
            case AUTO -> {
                if (uniform) {
                    resolved = SurrogateMethod.IAAFT;
                } else if (hasProvider) {
                    resolved = SurrogateMethod.SPECTRAL;
                } else {
                    String message = "Uneven sampling but no periodogram provider configured; falling back to IAAFT";
                    LOG.warn(message);
                    notes.add(Note.of(NoteCode.METHOD_FALLBACK, message));
                    resolved = SurrogateMethod.IAAFT;
                }
            }
            case SPECTRAL -> {
                if (hasProvider) {
                    resolved = SurrogateMethod.SPECTRAL;
                } else if (spectralConfig.isFallbackToIaaft()) {
                    String message = "Spectral surrogates requested without a periodogram provider; using IAAFT";
                    LOG.warn(message);
                    notes.add(Note.of(NoteCode.METHOD_FALLBACK, message));
                    resolved = SurrogateMethod.IAAFT;
                } else {
                    throw new MissingCapabilityException("periodogram",
                            "Spectral surrogates require a PeriodogramProvider");
                }
            }
            default -> resolved = SurrogateMethod.IAAFT;
        }
        if (resolved == SurrogateMethod.IAAFT && requested == SurrogateMethod.IAAFT && !uniform) {
            String message = "IAAFT applied to unevenly sampled data; results may be biased";
            LOG.warn(message);
            notes.add(Note.of(NoteCode.UNEVEN_SAMPLING_IAAFT, message));
        }
        LOG.debug("Surrogate method {} resolved to {} (uniform={}, provider={})",
                requested, resolved, uniform, hasProvider);
        return resolved;
    }

    /**
     * @param resolved {@code IAAFT} or {@code SPECTRAL}
     * @return a generator configured like this tester
     */
    public SurrogateGenerator generatorFor(SurrogateMethod resolved) {
        return SurrogateGeneratorFactory.create(resolved, periodogramProvider, iaaftConfig, spectralConfig);
    }

    public RankStatistic getRankStatistic() {
        return rankStatistic;
    }

    public SpectralConfig getSpectralConfig() {
        return spectralConfig;
    }

    public IaaftConfig getIaaftConfig() {
        return iaaftConfig;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static double pValue(double observed, double[] scores) {
        double threshold = Math.abs(observed);
        int extreme = 0;
        for (double s : scores) {
            if (Math.abs(s) >= threshold) {
                extreme++;
            }
        }
        return (1.0 + extreme) / (1.0 + scores.length);
    }

    static double zScore(double observed, double[] scores) {
        if (scores.length < 2) {
            return 0.0;
        }
        double sd = Math.sqrt(StatUtils.variance(scores));
        if (!(sd > 0)) {
            return 0.0;
        }
        return (observed - StatUtils.mean(scores)) / sd;
    }

    private static double[] select(double[] values, int[] order) {
        double[] out = new double[order.length];
        for (int i = 0; i < order.length; i++) {
            out[i] = values[order[i]];
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link SurrogateSignificanceTester}.
     */
    public static class Builder {
        private RankStatistic rankStatistic = new MannKendall();
        private PeriodogramProvider periodogramProvider;
        private IaaftConfig iaaftConfig = IaaftConfig.defaults();
        private SpectralConfig spectralConfig = SpectralConfig.defaults();
        private CensoringConfig censoringConfig = CensoringConfig.defaults();
        private boolean retainEnsemble;

        public Builder rankStatistic(RankStatistic rankStatistic) {
            this.rankStatistic = rankStatistic;
            return this;
        }

        /**
         * @param provider periodogram capability; {@code null} disables spectral synthesis
         * @return this builder
         */
        public Builder periodogramProvider(PeriodogramProvider provider) {
            this.periodogramProvider = provider;
            return this;
        }

        public Builder iaaftConfig(IaaftConfig iaaftConfig) {
            this.iaaftConfig = iaaftConfig;
            return this;
        }

        public Builder spectralConfig(SpectralConfig spectralConfig) {
            this.spectralConfig = spectralConfig;
            return this;
        }

        public Builder censoringConfig(CensoringConfig censoringConfig) {
            this.censoringConfig = censoringConfig;
            return this;
        }

        /**
         * @param retainEnsemble keep the scored ensemble on each result for diagnostics
         * @return this builder
         */
        public Builder retainEnsemble(boolean retainEnsemble) {
            this.retainEnsemble = retainEnsemble;
            return this;
        }

        public SurrogateSignificanceTester build() {
            Objects.requireNonNull(rankStatistic, "rankStatistic required");
            Objects.requireNonNull(iaaftConfig, "iaaftConfig required");
            Objects.requireNonNull(spectralConfig, "spectralConfig required");
            Objects.requireNonNull(censoringConfig, "censoringConfig required");
            return new SurrogateSignificanceTester(this);
        }
    }

    @Override
    public String toString() {
        return "SurrogateSignificanceTester{rankStatistic=" + rankStatistic
                + ", periodogramProvider=" + periodogramProvider + '}';
    }
}
