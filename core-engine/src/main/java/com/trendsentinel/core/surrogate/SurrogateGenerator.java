package com.trendsentinel.core.surrogate;

import com.trendsentinel.core.exception.NumericalException;
import com.trendsentinel.core.model.SurrogateEnsemble;
import com.trendsentinel.core.model.SurrogateMethod;

/**
 * Contract for colored-noise synthesizers.
 *
 * <p>
 * A generator turns one template series into {@code count} realizations that
 * share its amplitude distribution exactly and approximate its spectrum.
 * Realization {@code k} is driven by a seed derived from {@code seed} and
 * {@code k} alone, so equal inputs give bit-identical ensembles.
 * Implementations are stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public interface SurrogateGenerator {

    /**
     * @return the method this generator implements
     */
    SurrogateMethod method();

    /**
     * Generate an ensemble.
     *
     * @param times  sampling times, chronological
     * @param values template values (uncensored, finite)
     * @param dy     per-observation uncertainty, or {@code null}; ignored by
     *               generators that do not weight observations
     * @param count  number of realizations, {@code > 0}
     * @param seed   ensemble seed
     * @return the realizations with per-realization status
     * @throws NumericalException if any template value is NaN or infinite
     */
    SurrogateEnsemble generate(double[] times, double[] values, double[] dy, int count, long seed);

    /**
     * Reject templates holding NaN or infinite values.
     *
     * @param values template values
     * @throws NumericalException naming the first offending index
     */
    static void requireFinite(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new NumericalException("Template value at index " + i + " is not finite: " + values[i]);
            }
        }
    }
}
