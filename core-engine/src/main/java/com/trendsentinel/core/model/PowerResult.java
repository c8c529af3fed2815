package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Detection-power curve and minimum detectable trend of the surrogate test
 * against a colored-noise template.
 *
 * <p>
 * Use the {@link Builder}; {@code noiseMethod} and {@code slopeUnit} are
 * required.
 * </p>
 *
 * @since 1.0.0
 */
public final class PowerResult implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Target power defining the minimum detectable trend. */
    public static final double TARGET_POWER = 0.8;

    private final List<SlopePower> rows;
    private final double minDetectableTrend;
    private final int nSimulations;
    private final int nSurrogatesInner;
    private final double alpha;
    private final SurrogateMethod noiseMethod;
    private final SlopeUnit slopeUnit;
    private final boolean aborted;
    private final List<Note> notes;

    private PowerResult(Builder b) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(b.rows));
        this.minDetectableTrend = b.minDetectableTrend;
        this.nSimulations = b.nSimulations;
        this.nSurrogatesInner = b.nSurrogatesInner;
        this.alpha = b.alpha;
        this.noiseMethod = Objects.requireNonNull(b.noiseMethod, "noiseMethod must not be null");
        this.slopeUnit = Objects.requireNonNull(b.slopeUnit, "slopeUnit must not be null");
        this.aborted = b.aborted;
        this.notes = Collections.unmodifiableList(new ArrayList<>(b.notes));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link PowerResult}.
     */
    public static class Builder {
        private final List<SlopePower> rows = new ArrayList<>();
        private double minDetectableTrend = Double.NaN;
        private int nSimulations;
        private int nSurrogatesInner;
        private double alpha;
        private SurrogateMethod noiseMethod;
        private SlopeUnit slopeUnit;
        private boolean aborted;
        private final List<Note> notes = new ArrayList<>();

        public Builder row(SlopePower row) {
            rows.add(Objects.requireNonNull(row, "row must not be null"));
            return this;
        }

        public Builder minDetectableTrend(double minDetectableTrend) {
            this.minDetectableTrend = minDetectableTrend;
            return this;
        }

        public Builder nSimulations(int nSimulations) {
            this.nSimulations = nSimulations;
            return this;
        }

        public Builder nSurrogatesInner(int nSurrogatesInner) {
            this.nSurrogatesInner = nSurrogatesInner;
            return this;
        }

        public Builder alpha(double alpha) {
            this.alpha = alpha;
            return this;
        }

        public Builder noiseMethod(SurrogateMethod noiseMethod) {
            this.noiseMethod = noiseMethod;
            return this;
        }

        public Builder slopeUnit(SlopeUnit slopeUnit) {
            this.slopeUnit = slopeUnit;
            return this;
        }

        public Builder aborted(boolean aborted) {
            this.aborted = aborted;
            return this;
        }

        public Builder note(Note note) {
            notes.add(Objects.requireNonNull(note, "note must not be null"));
            return this;
        }

        public Builder notes(List<Note> notes) {
            notes.forEach(this::note);
            return this;
        }

        public PowerResult build() {
            return new PowerResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /** @return candidate slopes in caller units, in input order */
    public double[] getCandidateSlopes() {
        return rows.stream().mapToDouble(SlopePower::getSlope).toArray();
    }

    /** @return detection rate per candidate slope; NaN for rows not simulated */
    public double[] getDetectionRates() {
        return rows.stream().mapToDouble(SlopePower::getDetectionRate).toArray();
    }

    public List<SlopePower> getRows() {
        return rows;
    }

    /** @return slope reaching {@value #TARGET_POWER} power, or NaN */
    public double getMinDetectableTrend() {
        return minDetectableTrend;
    }

    @JsonProperty("nSimulations")
    public int getNSimulations() {
        return nSimulations;
    }

    @JsonProperty("nSurrogatesInner")
    public int getNSurrogatesInner() {
        return nSurrogatesInner;
    }

    public double getAlpha() {
        return alpha;
    }

    public SurrogateMethod getNoiseMethod() {
        return noiseMethod;
    }

    public SlopeUnit getSlopeUnit() {
        return slopeUnit;
    }

    public boolean isAborted() {
        return aborted;
    }

    public List<Note> getNotes() {
        return notes;
    }

    public boolean hasNote(NoteCode code) {
        return notes.stream().anyMatch(n -> n.getCode() == code);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PowerResult that))
            return false;
        return rows.equals(that.rows)
                && Double.compare(minDetectableTrend, that.minDetectableTrend) == 0
                && nSimulations == that.nSimulations
                && nSurrogatesInner == that.nSurrogatesInner
                && Double.compare(alpha, that.alpha) == 0
                && noiseMethod == that.noiseMethod
                && slopeUnit == that.slopeUnit
                && aborted == that.aborted
                && notes.equals(that.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, minDetectableTrend, nSimulations, nSurrogatesInner, alpha,
                noiseMethod, slopeUnit, aborted);
    }

    @Override
    public String toString() {
        return "PowerResult{" +
                "rows=" + rows +
                ", minDetectableTrend=" + minDetectableTrend +
                ", nSimulations=" + nSimulations +
                ", nSurrogatesInner=" + nSurrogatesInner +
                ", noiseMethod=" + noiseMethod +
                ", aborted=" + aborted +
                '}';
    }
}
