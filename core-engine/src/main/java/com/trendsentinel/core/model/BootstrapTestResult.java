package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a block-bootstrap trend test.
 *
 * @since 1.0.0
 */
public final class BootstrapTestResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double pValue;
    private final double observedScore;
    private final double[] bootstrapScores;
    private final double bootstrapVariance;
    private final int blockSize;
    private final List<Note> notes;

    public BootstrapTestResult(double pValue, double observedScore, double[] bootstrapScores,
                               double bootstrapVariance, int blockSize, List<Note> notes) {
        this.pValue = pValue;
        this.observedScore = observedScore;
        this.bootstrapScores = bootstrapScores.clone();
        this.bootstrapVariance = bootstrapVariance;
        this.blockSize = blockSize;
        this.notes = Collections.unmodifiableList(new ArrayList<>(notes));
    }

    /** @return fraction of bootstrap scores at least as extreme as the observed one */
    @JsonProperty("pValue")
    public double getPValue() {
        return pValue;
    }

    public double getObservedScore() {
        return observedScore;
    }

    public double[] getBootstrapScores() {
        return bootstrapScores.clone();
    }

    /** @return sample variance of the bootstrap scores, an autocorrelation-aware Var(S) */
    public double getBootstrapVariance() {
        return bootstrapVariance;
    }

    public int getBlockSize() {
        return blockSize;
    }

    public List<Note> getNotes() {
        return notes;
    }

    @Override
    public String toString() {
        return "BootstrapTestResult{pValue=" + pValue + ", observedScore=" + observedScore
                + ", bootstrapVariance=" + bootstrapVariance + ", blockSize=" + blockSize + '}';
    }
}
