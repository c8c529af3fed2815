package com.trendsentinel.core.model;

/**
 * State of an iterative surrogate refinement.
 *
 * <pre>
 * INITIALIZING → ITERATING → CONVERGED | STALLED | MAX_ITER_REACHED
 * </pre>
 *
 * @since 1.0.0
 */
public enum RefinementStatus {
    INITIALIZING,
    ITERATING,
    /** The change between iterates fell below the tolerance. */
    CONVERGED,
    /** The change stopped decreasing; the better prior iterate was kept. */
    STALLED,
    MAX_ITER_REACHED;

    /**
     * @return {@code true} for the three terminal states
     */
    public boolean isTerminal() {
        return this == CONVERGED || this == STALLED || this == MAX_ITER_REACHED;
    }
}
