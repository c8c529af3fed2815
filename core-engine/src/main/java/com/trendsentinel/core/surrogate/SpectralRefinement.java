package com.trendsentinel.core.surrogate;

import com.trendsentinel.core.model.RefinementStatus;

/**
 * Immutable state of one spectral-synthesis realization: the synthesis
 * amplitudes, the fixed random phases and the rank-adjusted iterate.
 *
 * @since 1.0.0
 */
public final class SpectralRefinement {

    private final double[] amplitudes;
    private final double[] phases;
    private final double[] current;
    private final double[] previous;
    private final double previousError;
    private final int iteration;
    private final RefinementStatus status;

    SpectralRefinement(double[] amplitudes, double[] phases, double[] current, double[] previous,
                       double previousError, int iteration, RefinementStatus status) {
        this.amplitudes = amplitudes;
        this.phases = phases;
        this.current = current;
        this.previous = previous;
        this.previousError = previousError;
        this.iteration = iteration;
        this.status = status;
    }

    double[] amplitudes() {
        return amplitudes;
    }

    double[] phases() {
        return phases;
    }

    double[] current() {
        return current;
    }

    double[] previous() {
        return previous;
    }

    /** @return relative spectral error of the previous iterate, infinite before the first comparison */
    public double getPreviousError() {
        return previousError;
    }

    /** @return number of synthesis passes so far */
    public int getIteration() {
        return iteration;
    }

    public RefinementStatus getStatus() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    @Override
    public String toString() {
        return "SpectralRefinement{iteration=" + iteration + ", previousError=" + previousError
                + ", status=" + status + '}';
    }
}
