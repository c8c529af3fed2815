package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a surrogate significance test.
 *
 * <p>
 * The observed rank statistic is compared with the empirical null
 * distribution formed by the surrogate scores. Instances are immutable; use
 * the {@link Builder} to construct them. {@code method} is required and
 * {@link Builder#build()} throws {@link NullPointerException} without it.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignificanceResult implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Significance level applied to {@link #isSignificant()}. */
    public static final double DEFAULT_SIGNIFICANCE_LEVEL = 0.05;

    /** Surrogate method actually used, after auto-selection or fallback. */
    private final SurrogateMethod method;

    private final double originalScore;
    private final double[] surrogateScores;
    private final double pValue;
    private final double zScore;
    private final int nSurrogates;
    private final boolean significant;
    private final List<Note> notes;

    /** Scored null ensemble, kept only when the tester is asked to retain it. */
    private final transient SurrogateEnsemble ensemble;

    private SignificanceResult(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.originalScore = builder.originalScore;
        this.surrogateScores = builder.surrogateScores != null ? builder.surrogateScores.clone() : new double[0];
        this.pValue = builder.pValue;
        this.zScore = builder.zScore;
        this.nSurrogates = builder.nSurrogates;
        this.significant = builder.pValue < DEFAULT_SIGNIFICANCE_LEVEL;
        this.notes = Collections.unmodifiableList(new ArrayList<>(builder.notes));
        this.ensemble = builder.ensemble;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link SignificanceResult}.
     */
    public static class Builder {
        private SurrogateMethod method;
        private double originalScore;
        private double[] surrogateScores;
        private double pValue = 1.0;
        private double zScore;
        private int nSurrogates;
        private final List<Note> notes = new ArrayList<>();
        private SurrogateEnsemble ensemble;

        public Builder method(SurrogateMethod method) {
            this.method = method;
            return this;
        }

        public Builder originalScore(double originalScore) {
            this.originalScore = originalScore;
            return this;
        }

        public Builder surrogateScores(double[] surrogateScores) {
            this.surrogateScores = surrogateScores;
            return this;
        }

        public Builder pValue(double pValue) {
            this.pValue = pValue;
            return this;
        }

        public Builder zScore(double zScore) {
            this.zScore = zScore;
            return this;
        }

        public Builder nSurrogates(int nSurrogates) {
            this.nSurrogates = nSurrogates;
            return this;
        }

        public Builder note(Note note) {
            this.notes.add(Objects.requireNonNull(note, "note must not be null"));
            return this;
        }

        public Builder notes(List<Note> notes) {
            notes.forEach(this::note);
            return this;
        }

        public Builder ensemble(SurrogateEnsemble ensemble) {
            this.ensemble = ensemble;
            return this;
        }

        public SignificanceResult build() {
            return new SignificanceResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public SurrogateMethod getMethod() {
        return method;
    }

    public double getOriginalScore() {
        return originalScore;
    }

    /** @return a copy of the surrogate scores, in generation order */
    public double[] getSurrogateScores() {
        return surrogateScores.clone();
    }

    @JsonProperty("pValue")
    public double getPValue() {
        return pValue;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    @JsonProperty("nSurrogates")
    public int getNSurrogates() {
        return nSurrogates;
    }

    /** @return {@code true} when {@code pValue < 0.05} */
    public boolean isSignificant() {
        return significant;
    }

    /** @return unmodifiable list of notes */
    public List<Note> getNotes() {
        return notes;
    }

    public boolean hasNote(NoteCode code) {
        return notes.stream().anyMatch(n -> n.getCode() == code);
    }

    /**
     * @return the scored realizations behind this result, if retained
     */
    @JsonIgnore
    public Optional<SurrogateEnsemble> getEnsemble() {
        return Optional.ofNullable(ensemble);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignificanceResult that))
            return false;
        return method == that.method
                && Double.compare(originalScore, that.originalScore) == 0
                && Arrays.equals(surrogateScores, that.surrogateScores)
                && Double.compare(pValue, that.pValue) == 0
                && Double.compare(zScore, that.zScore) == 0
                && nSurrogates == that.nSurrogates
                && notes.equals(that.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, originalScore, Arrays.hashCode(surrogateScores), pValue, zScore, nSurrogates);
    }

    @Override
    public String toString() {
        return "SignificanceResult{" +
                "method=" + method +
                ", originalScore=" + originalScore +
                ", pValue=" + pValue +
                ", zScore=" + zScore +
                ", nSurrogates=" + nSurrogates +
                ", significant=" + significant +
                ", notes=" + notes +
                '}';
    }
}
