package com.trendsentinel.core.spectral;

import java.util.Objects;

/**
 * Power evaluated on a frequency grid.
 *
 * @since 1.0.0
 */
public final class Periodogram {

    private final double[] frequencies;
    private final double[] power;

    public Periodogram(double[] frequencies, double[] power) {
        Objects.requireNonNull(frequencies, "frequencies must not be null");
        Objects.requireNonNull(power, "power must not be null");
        if (frequencies.length != power.length) {
            throw new IllegalArgumentException("Expected one power value per frequency: "
                    + power.length + " != " + frequencies.length);
        }
        this.frequencies = frequencies.clone();
        this.power = power.clone();
    }

    public int size() {
        return frequencies.length;
    }

    public double[] getFrequencies() {
        return frequencies.clone();
    }

    public double[] getPower() {
        return power.clone();
    }

    /**
     * @return {@code true} if at least one bin has finite, strictly positive power
     */
    public boolean hasUsablePower() {
        for (double p : power) {
            if (Double.isFinite(p) && p > 0) {
                return true;
            }
        }
        return false;
    }
}
