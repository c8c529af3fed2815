package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * One row of a power curve: how often a given injected slope was detected.
 *
 * @since 1.0.0
 */
public final class SlopePower implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Slope in caller units. */
    private final double slope;

    /** Slope in value per second (or raw units for {@link SlopeUnit#NONE}). */
    private final double internalSlope;

    private final int detections;
    private final int completedSimulations;
    private final double detectionRate;

    public SlopePower(double slope, double internalSlope, int detections,
                      int completedSimulations, double detectionRate) {
        this.slope = slope;
        this.internalSlope = internalSlope;
        this.detections = detections;
        this.completedSimulations = completedSimulations;
        this.detectionRate = detectionRate;
    }

    /**
     * Row for a slope that was not simulated (NaN slope or aborted run).
     *
     * @param slope         slope in caller units
     * @param internalSlope converted slope
     * @return a row whose detection rate is NaN
     */
    public static SlopePower notSimulated(double slope, double internalSlope) {
        return new SlopePower(slope, internalSlope, 0, 0, Double.NaN);
    }

    public double getSlope() {
        return slope;
    }

    public double getInternalSlope() {
        return internalSlope;
    }

    public int getDetections() {
        return detections;
    }

    public int getCompletedSimulations() {
        return completedSimulations;
    }

    @JsonProperty("detectionRate")
    public double getDetectionRate() {
        return detectionRate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SlopePower that))
            return false;
        return Double.compare(slope, that.slope) == 0
                && Double.compare(internalSlope, that.internalSlope) == 0
                && detections == that.detections
                && completedSimulations == that.completedSimulations
                && Double.compare(detectionRate, that.detectionRate) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(slope, internalSlope, detections, completedSimulations, detectionRate);
    }

    @Override
    public String toString() {
        return "SlopePower{slope=" + slope + ", internalSlope=" + internalSlope
                + ", detections=" + detections + "/" + completedSimulations
                + ", rate=" + detectionRate + '}';
    }
}
