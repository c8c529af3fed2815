package com.trendsentinel.core.surrogate;

import com.trendsentinel.core.config.IaaftConfig;
import com.trendsentinel.core.model.Note;
import com.trendsentinel.core.model.NoteCode;
import com.trendsentinel.core.model.RefinementStatus;
import com.trendsentinel.core.model.SurrogateEnsemble;
import com.trendsentinel.core.model.SurrogateMethod;
import com.trendsentinel.core.random.SeedSequence;
import com.trendsentinel.core.spectral.Dft;
import com.trendsentinel.core.stats.Ranks;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.util.MathArrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Iterated Amplitude Adjusted Fourier Transform surrogates for evenly
 * sampled series.
 *
 * <p>
 * Each realization starts from a random permutation of the template and
 * alternates two projections until the ordering settles:
 * </p>
 * <ol>
 * <li>impose the template's Fourier magnitudes while keeping the current
 * phases;</li>
 * <li>rank-substitute the template's sorted values.</li>
 * </ol>
 *
 * <p>
 * The change between iterates is {@code mean((new - prev)^2) / var(template)}.
 * A run ends {@code CONVERGED} when the change drops below the tolerance,
 * {@code STALLED} when it stops decreasing (the earlier iterate is kept), or
 * {@code MAX_ITER_REACHED}. Every realization holds exactly the template's
 * value multiset whatever the outcome.
 * </p>
 *
 * @since 1.0.0
 */
public final class IaaftGenerator implements SurrogateGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(IaaftGenerator.class);

    private final IaaftConfig config;

    public IaaftGenerator() {
        this(IaaftConfig.defaults());
    }

    public IaaftGenerator(IaaftConfig config) {
        this.config = Objects.requireNonNull(config, "IaaftConfig must not be null");
    }

    @Override
    public SurrogateMethod method() {
        return SurrogateMethod.IAAFT;
    }

    /**
     * Convenience overload for callers without sampling times.
     */
    public SurrogateEnsemble generate(double[] values, int count, long seed) {
        return generate(null, values, null, count, seed);
    }

    @Override
    public SurrogateEnsemble generate(double[] times, double[] values, double[] dy, int count, long seed) {
        Objects.requireNonNull(values, "values must not be null");
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0, got: " + count);
        }
        SurrogateGenerator.requireFinite(values);
        int n = values.length;
        double[][] realizations = new double[count][];
        RefinementStatus[] statuses = new RefinementStatus[count];
        List<Note> notes = new ArrayList<>();

        double variance = n > 0 ? StatUtils.populationVariance(values) : 0.0;
        if (variance == 0) {
            LOG.debug("Zero-variance template, returning {} copies", count);
            for (int k = 0; k < count; k++) {
                realizations[k] = values.clone();
                statuses[k] = RefinementStatus.CONVERGED;
            }
            return new SurrogateEnsemble(SurrogateMethod.IAAFT, realizations, statuses, notes);
        }

        double[] sortedTarget = Ranks.sortedCopy(values);
        double[] amplitudes = Dft.amplitudes(values);
        SeedSequence seeds = SeedSequence.of(seed);

        for (int k = 0; k < count; k++) {
            IaaftIteration state = IaaftIteration.start(permute(values, seeds.generator(k)));
            while (!state.isTerminal()) {
                state = step(state, amplitudes, sortedTarget, variance, config);
            }
            realizations[k] = state.current();
            statuses[k] = state.getStatus();
            LOG.trace("Realization {} ended {} after {} iteration(s)", k, state.getStatus(), state.getIteration());
        }

        long unsettled = countNotConverged(statuses);
        if (unsettled > 0) {
            String message = unsettled + " of " + count + " IAAFT realization(s) did not converge to tolerance "
                    + config.getTolerance();
            LOG.warn(message);
            notes.add(Note.of(NoteCode.NOT_CONVERGED, message));
        }
        return new SurrogateEnsemble(SurrogateMethod.IAAFT, realizations, statuses, notes);
    }

    /**
     * One IAAFT iteration. Pure: the input state is not modified.
     *
     * @param state        current state; returned unchanged if terminal
     * @param amplitudes   template Fourier magnitudes
     * @param sortedTarget template values, ascending
     * @param variance     template variance, {@code > 0}
     * @param config       tolerance and iteration bound
     * @return the next state
     */
    public static IaaftIteration step(IaaftIteration state, double[] amplitudes, double[] sortedTarget,
                                      double variance, IaaftConfig config) {
        if (state.isTerminal()) {
            return state;
        }
        double[] prev = state.current();
        double[] next = Ranks.substitute(Dft.imposeAmplitudes(prev, amplitudes), sortedTarget);

        double sq = 0;
        for (int i = 0; i < next.length; i++) {
            double d = next[i] - prev[i];
            sq += d * d;
        }
        double change = sq / next.length / variance;
        int iteration = state.getIteration() + 1;

        if (change < config.getTolerance()) {
            return new IaaftIteration(next, change, iteration, RefinementStatus.CONVERGED);
        }
        if (change >= state.getPreviousChange()) {
            return new IaaftIteration(prev, state.getPreviousChange(), iteration, RefinementStatus.STALLED);
        }
        if (iteration >= config.getMaxIter()) {
            return new IaaftIteration(next, change, iteration, RefinementStatus.MAX_ITER_REACHED);
        }
        return new IaaftIteration(next, change, iteration, RefinementStatus.ITERATING);
    }

    static double[] permute(double[] values, RandomGenerator rng) {
        int[] order = MathArrays.natural(values.length);
        MathArrays.shuffle(order, rng);
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[order[i]];
        }
        return out;
    }

    static long countNotConverged(RefinementStatus[] statuses) {
        long count = 0;
        for (RefinementStatus s : statuses) {
            if (s != RefinementStatus.CONVERGED) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "IaaftGenerator{" + config + '}';
    }
}
