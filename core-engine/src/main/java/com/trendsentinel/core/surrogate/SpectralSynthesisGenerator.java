package com.trendsentinel.core.surrogate;

import com.trendsentinel.core.config.SpectralConfig;
import com.trendsentinel.core.exception.MissingCapabilityException;
import com.trendsentinel.core.exception.NumericalException;
import com.trendsentinel.core.model.Note;
import com.trendsentinel.core.model.NoteCode;
import com.trendsentinel.core.model.RefinementStatus;
import com.trendsentinel.core.model.SurrogateEnsemble;
import com.trendsentinel.core.model.SurrogateMethod;
import com.trendsentinel.core.random.SeedSequence;
import com.trendsentinel.core.spectral.Periodogram;
import com.trendsentinel.core.spectral.PeriodogramProvider;
import com.trendsentinel.core.stats.Ranks;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Surrogates for unevenly sampled series by random-phase spectral synthesis.
 *
 * <p>
 * The template's periodogram is evaluated once on the provider's frequency
 * grid, restricted to the band from one cycle per baseline up to the
 * mean-step Nyquist frequency, and its square root taken as the synthesis
 * amplitude per bin. Each realization
 * draws one uniform phase per bin, sums the cosines at the original sampling
 * times and rank-substitutes the template's sorted values into the sum.
 * </p>
 *
 * <h3>Refinement</h3>
 * <p>
 * With {@code maxIter > 1} the periodogram of the adjusted realization is
 * recomputed on the same grid and every synthesis amplitude is multiplied
 * by {@code (target / achieved)^dampingExponent} before synthesizing again
 * with the same phases. A refinement ends {@code CONVERGED} when the relative
 * amplitude error drops below {@value #REFINEMENT_TOLERANCE}, {@code STALLED}
 * when the error stops falling (the earlier iterate is kept) or
 * {@code MAX_ITER_REACHED}. A single pass always ends in
 * {@code MAX_ITER_REACHED}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SpectralSynthesisGenerator implements SurrogateGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SpectralSynthesisGenerator.class);

    /** Relative RMS amplitude error under which refinement stops. */
    public static final double REFINEMENT_TOLERANCE = 1e-3;

    /** Above this many synthesized samples the run is flagged as expensive. */
    static final long COST_WARNING_THRESHOLD = 2_000_000L;

    private static final int FREQUENCY_CHUNK = 1000;

    private final PeriodogramProvider provider;
    private final SpectralConfig config;

    /**
     * @param provider periodogram capability; may be {@code null}, in which case
     *                 generation of non-constant templates fails
     * @param config   synthesis settings
     */
    public SpectralSynthesisGenerator(PeriodogramProvider provider, SpectralConfig config) {
        this.provider = provider;
        this.config = Objects.requireNonNull(config, "SpectralConfig must not be null");
    }

    @Override
    public SurrogateMethod method() {
        return SurrogateMethod.SPECTRAL;
    }

    @Override
    public SurrogateEnsemble generate(double[] times, double[] values, double[] dy, int count, long seed) {
        Objects.requireNonNull(times, "times must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (times.length != values.length) {
            throw new IllegalArgumentException("times and values lengths differ: "
                    + times.length + " != " + values.length);
        }
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0, got: " + count);
        }
        SurrogateGenerator.requireFinite(values);
        int n = values.length;
        double[][] realizations = new double[count][];
        RefinementStatus[] statuses = new RefinementStatus[count];
        List<Note> notes = new ArrayList<>();

        if (n == 0 || StatUtils.min(values) == StatUtils.max(values)) {
            LOG.debug("Zero-variance template, returning {} copies", count);
            for (int k = 0; k < count; k++) {
                realizations[k] = values.clone();
                statuses[k] = RefinementStatus.CONVERGED;
            }
            return new SurrogateEnsemble(SurrogateMethod.SPECTRAL, realizations, statuses, notes);
        }
        if (provider == null) {
            throw new MissingCapabilityException("periodogram",
                    "Spectral surrogates need a PeriodogramProvider; none was configured");
        }

        if ((long) n * count > COST_WARNING_THRESHOLD) {
            String message = "Spectral synthesis for " + n + " samples x " + count
                    + " surrogates is expensive; consider fewer surrogates or aggregating the data";
            LOG.warn(message);
            notes.add(Note.of(NoteCode.PERFORMANCE_WARNING, message));
        }

        double[] shifted = shift(times);
        double[] frequencies = synthesisBand(shifted, provider.frequencyGrid(shifted, config));
        Periodogram reference = provider.compute(shifted, values, dy, frequencies, config);
        if (!reference.hasUsablePower()) {
            throw new NumericalException("Periodogram has no finite positive power; cannot synthesize surrogates");
        }
        double[] target = amplitudesOf(reference.getPower());
        double[] sortedTarget = Ranks.sortedCopy(values);
        SeedSequence seeds = SeedSequence.of(seed);
        LOG.debug("Synthesizing {} realization(s) over {} frequencies", count, frequencies.length);

        for (int k = 0; k < count; k++) {
            SpectralRefinement state = start(shifted, frequencies, target, sortedTarget, seeds.generator(k));
            while (!state.isTerminal()) {
                state = step(state, shifted, dy, frequencies, target, sortedTarget);
            }
            realizations[k] = state.current();
            statuses[k] = state.getStatus();
        }

        if (config.getMaxIter() > 1) {
            long unsettled = IaaftGenerator.countNotConverged(statuses);
            if (unsettled > 0) {
                String message = unsettled + " of " + count
                        + " spectral realization(s) did not reach the amplitude tolerance";
                LOG.warn(message);
                notes.add(Note.of(NoteCode.NOT_CONVERGED, message));
            }
        }
        return new SurrogateEnsemble(SurrogateMethod.SPECTRAL, realizations, statuses, notes);
    }

    // ---------------------------------------------------------------
    // Refinement state machine
    // ---------------------------------------------------------------

    private SpectralRefinement start(double[] times, double[] frequencies, double[] target,
                                     double[] sortedTarget, RandomGenerator rng) {
        double[] phases = new double[frequencies.length];
        for (int f = 0; f < phases.length; f++) {
            phases[f] = 2 * Math.PI * rng.nextDouble();
        }
        double[] amplitudes = target.clone();
        double[] first = Ranks.substitute(synthesize(times, frequencies, amplitudes, phases), sortedTarget);
        RefinementStatus status = config.getMaxIter() <= 1
                ? RefinementStatus.MAX_ITER_REACHED
                : RefinementStatus.ITERATING;
        return new SpectralRefinement(amplitudes, phases, first, first, Double.POSITIVE_INFINITY, 1, status);
    }

    /**
     * One refinement pass. Pure: the input state is not modified.
     */
    SpectralRefinement step(SpectralRefinement state, double[] times, double[] dy,
                            double[] frequencies, double[] target, double[] sortedTarget) {
        if (state.isTerminal()) {
            return state;
        }
        if (state.getIteration() >= config.getMaxIter()) {
            return new SpectralRefinement(state.amplitudes(), state.phases(), state.current(), state.previous(),
                    state.getPreviousError(), state.getIteration(), RefinementStatus.MAX_ITER_REACHED);
        }
        double[] achieved = amplitudesOf(
                provider.compute(times, state.current(), dy, frequencies, config).getPower());
        double error = relativeError(achieved, target);
        LOG.trace("Pass {} relative amplitude error {}", state.getIteration(), error);

        if (error < REFINEMENT_TOLERANCE) {
            return new SpectralRefinement(state.amplitudes(), state.phases(), state.current(), state.previous(),
                    error, state.getIteration(), RefinementStatus.CONVERGED);
        }
        if (error >= state.getPreviousError()) {
            return new SpectralRefinement(state.amplitudes(), state.phases(), state.previous(), state.previous(),
                    state.getPreviousError(), state.getIteration(), RefinementStatus.STALLED);
        }

        double damping = config.getDampingExponent();
        double[] amplitudes = state.amplitudes().clone();
        for (int f = 0; f < amplitudes.length; f++) {
            if (achieved[f] > 0 && target[f] > 0) {
                amplitudes[f] *= Math.pow(target[f] / achieved[f], damping);
            }
        }
        double[] next = Ranks.substitute(synthesize(times, frequencies, amplitudes, state.phases()), sortedTarget);
        return new SpectralRefinement(amplitudes, state.phases(), next, state.current(), error,
                state.getIteration() + 1, RefinementStatus.ITERATING);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Sum of {@code a cos(2 pi f t + phi)} over all bins, accumulated one
     * frequency chunk at a time.
     */
    static double[] synthesize(double[] times, double[] frequencies, double[] amplitudes, double[] phases) {
        int n = times.length;
        double[] out = new double[n];
        for (int from = 0; from < frequencies.length; from += FREQUENCY_CHUNK) {
            int to = Math.min(from + FREQUENCY_CHUNK, frequencies.length);
            for (int i = 0; i < n; i++) {
                double twoPiT = 2 * Math.PI * times[i];
                double sum = 0;
                for (int f = from; f < to; f++) {
                    sum += amplitudes[f] * Math.cos(twoPiT * frequencies[f] + phases[f]);
                }
                out[i] += sum;
            }
        }
        return out;
    }

    /**
     * Bins between one cycle per baseline and the mean-step Nyquist frequency.
     * Slower bins look like a ramp over the record and bins near multiples of
     * the sampling rate alias back to it, so both would carry the observed
     * trend into the null. The whole grid is returned if the band is empty.
     *
     * @param times  shifted sampling times, earliest at zero
     * @param grid   provider frequency grid, ascending
     * @return the bins used for synthesis
     */
    static double[] synthesisBand(double[] times, double[] grid) {
        int n = times.length;
        double baseline = StatUtils.max(times) - StatUtils.min(times);
        double low = 1.0 / baseline;
        double high = Math.max(low, 0.5 * (n - 1) / baseline);
        double[] band = Arrays.stream(grid)
                .filter(f -> f >= low * (1 - 1e-9) && f <= high * (1 + 1e-9))
                .toArray();
        if (band.length == 0) {
            LOG.debug("No grid frequency within [{}, {}]; synthesizing over all {} bins", low, high, grid.length);
            return grid;
        }
        return band;
    }

    static double[] shift(double[] times) {
        double min = StatUtils.min(times);
        double[] out = new double[times.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = times[i] - min;
        }
        return out;
    }

    private static double[] amplitudesOf(double[] power) {
        double[] amp = new double[power.length];
        for (int f = 0; f < power.length; f++) {
            double p = power[f];
            amp[f] = Double.isFinite(p) && p > 0 ? Math.sqrt(p) : 0.0;
        }
        return amp;
    }

    private static double relativeError(double[] achieved, double[] target) {
        double num = 0;
        double den = 0;
        for (int f = 0; f < target.length; f++) {
            double d = achieved[f] - target[f];
            num += d * d;
            den += target[f] * target[f];
        }
        return den > 0 ? Math.sqrt(num / den) : 0.0;
    }

    @Override
    public String toString() {
        return "SpectralSynthesisGenerator{provider=" + provider + ", config=" + config + '}';
    }
}
