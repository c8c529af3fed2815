package com.trendsentinel.core.model;

/**
 * Machine-readable category of a {@link Note}.
 *
 * @since 1.0.0
 */
public enum NoteCode {
    /** The requested surrogate method was replaced by IAAFT. */
    METHOD_FALLBACK,
    /** IAAFT was used on irregularly sampled data. */
    UNEVEN_SAMPLING_IAAFT,
    /** The estimated amount of work is large. */
    PERFORMANCE_WARNING,
    /** Imputing censored values changed the observed rank statistic. */
    IMPUTATION_CHANGED_STATISTIC,
    /** Censoring was propagated onto the surrogates by rank. */
    CENSORED_SURROGATES,
    /** The input has zero variance. */
    CONSTANT_INPUT,
    /** At least one iterative refinement stalled before converging. */
    NOT_CONVERGED,
    /** The run was aborted before all work completed. */
    ABORTED,
    /** A candidate slope was NaN and its row was not simulated. */
    NAN_SLOPE
}
