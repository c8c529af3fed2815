package com.trendsentinel.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A set of noise realizations generated from one template series, optionally
 * with their rank-statistic scores.
 *
 * <p>
 * Every realization holds exactly the template's sorted value multiset in a
 * new temporal order. The ensemble is the empirical null distribution of a
 * surrogate test; it has no meaning outside that role.
 * </p>
 *
 * @since 1.0.0
 */
public final class SurrogateEnsemble {

    private final SurrogateMethod method;
    private final double[][] realizations;
    private final RefinementStatus[] statuses;
    private final double[] scores;
    private final List<Note> notes;

    public SurrogateEnsemble(SurrogateMethod method, double[][] realizations,
                             RefinementStatus[] statuses, List<Note> notes) {
        this(method, realizations, statuses, null, notes);
    }

    private SurrogateEnsemble(SurrogateMethod method, double[][] realizations,
                              RefinementStatus[] statuses, double[] scores, List<Note> notes) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(realizations, "realizations must not be null");
        Objects.requireNonNull(statuses, "statuses must not be null");
        if (statuses.length != realizations.length) {
            throw new IllegalArgumentException("Expected one status per realization: "
                    + statuses.length + " != " + realizations.length);
        }
        if (scores != null && scores.length != realizations.length) {
            throw new IllegalArgumentException("Expected one score per realization: "
                    + scores.length + " != " + realizations.length);
        }
        this.realizations = new double[realizations.length][];
        for (int i = 0; i < realizations.length; i++) {
            this.realizations[i] = realizations[i].clone();
        }
        this.statuses = statuses.clone();
        this.scores = scores != null ? scores.clone() : null;
        this.notes = Collections.unmodifiableList(new ArrayList<>(notes));
    }

    /**
     * Attach the rank-statistic score of each realization.
     *
     * @param realizationScores one score per realization, in order
     * @return a new ensemble carrying the scores
     */
    public SurrogateEnsemble withScores(double[] realizationScores) {
        Objects.requireNonNull(realizationScores, "realizationScores must not be null");
        return new SurrogateEnsemble(method, realizations, statuses, realizationScores, notes);
    }

    public SurrogateMethod getMethod() {
        return method;
    }

    /** @return number of realizations */
    public int size() {
        return realizations.length;
    }

    /** @return a copy of realization {@code i} */
    public double[] getRealization(int i) {
        return realizations[i].clone();
    }

    public RefinementStatus getStatus(int i) {
        return statuses[i];
    }

    /**
     * @param status a refinement status
     * @return how many realizations ended in {@code status}
     */
    public long countStatus(RefinementStatus status) {
        return Arrays.stream(statuses).filter(s -> s == status).count();
    }

    public boolean hasScores() {
        return scores != null;
    }

    /**
     * @return a copy of the scores
     * @throws IllegalStateException if no scores were attached
     */
    public double[] getScores() {
        if (scores == null) {
            throw new IllegalStateException("Ensemble has not been scored");
        }
        return scores.clone();
    }

    public List<Note> getNotes() {
        return notes;
    }

    @Override
    public String toString() {
        return "SurrogateEnsemble{method=" + method + ", size=" + realizations.length
                + ", scored=" + (scores != null) + ", notes=" + notes + '}';
    }
}
