package com.trendsentinel.core.surrogate;

import com.trendsentinel.core.model.RefinementStatus;

/**
 * Immutable state of one IAAFT refinement run.
 *
 * @since 1.0.0
 */
public final class IaaftIteration {

    private final double[] current;
    private final double previousChange;
    private final int iteration;
    private final RefinementStatus status;

    IaaftIteration(double[] current, double previousChange, int iteration, RefinementStatus status) {
        this.current = current;
        this.previousChange = previousChange;
        this.iteration = iteration;
        this.status = status;
    }

    /**
     * @param start initial ordering, typically a random permutation of the template
     * @return state before the first iteration
     */
    public static IaaftIteration start(double[] start) {
        return new IaaftIteration(start.clone(), Double.POSITIVE_INFINITY, 0, RefinementStatus.INITIALIZING);
    }

    double[] current() {
        return current;
    }

    public double getPreviousChange() {
        return previousChange;
    }

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
        return "IaaftIteration{iteration=" + iteration + ", previousChange=" + previousChange
                + ", status=" + status + '}';
    }
}
