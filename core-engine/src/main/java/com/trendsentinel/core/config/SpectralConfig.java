package com.trendsentinel.core.config;

import com.trendsentinel.core.spectral.FrequencyMethod;
import com.trendsentinel.core.spectral.Normalization;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed configuration of the spectral-synthesis surrogate generator and of
 * the periodogram it relies on.
 *
 * @since 1.0.0
 */
public final class SpectralConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Exponent applied to the target/achieved amplitude ratio during refinement. */
    public static final double DEFAULT_DAMPING_EXPONENT = 0.8;

    private static final SpectralConfig DEFAULTS = new Builder().build();

    private final FrequencyMethod frequencyMethod;
    private final Normalization normalization;
    private final boolean fitMean;
    private final boolean centerData;
    private final int maxIter;
    private final double dampingExponent;
    private final double samplesPerPeak;
    private final double nyquistFactor;
    private final boolean fallbackToIaaft;

    private SpectralConfig(Builder b) {
        this.frequencyMethod = b.frequencyMethod;
        this.normalization = b.normalization;
        this.fitMean = b.fitMean;
        this.centerData = b.centerData;
        this.maxIter = b.maxIter;
        this.dampingExponent = b.dampingExponent;
        this.samplesPerPeak = b.samplesPerPeak;
        this.nyquistFactor = b.nyquistFactor;
        this.fallbackToIaaft = b.fallbackToIaaft;
    }

    public static SpectralConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public FrequencyMethod getFrequencyMethod() {
        return frequencyMethod;
    }

    public Normalization getNormalization() {
        return normalization;
    }

    public boolean isFitMean() {
        return fitMean;
    }

    public boolean isCenterData() {
        return centerData;
    }

    /** @return synthesis passes per realization; 1 disables amplitude refinement */
    public int getMaxIter() {
        return maxIter;
    }

    public double getDampingExponent() {
        return dampingExponent;
    }

    public double getSamplesPerPeak() {
        return samplesPerPeak;
    }

    public double getNyquistFactor() {
        return nyquistFactor;
    }

    /** @return whether an explicit spectral request may be served by IAAFT when no periodogram is available */
    public boolean isFallbackToIaaft() {
        return fallbackToIaaft;
    }

    /**
     * Fluent builder for {@link SpectralConfig}.
     */
    public static class Builder {
        private FrequencyMethod frequencyMethod = FrequencyMethod.AUTO;
        private Normalization normalization = Normalization.STANDARD;
        private boolean fitMean = true;
        private boolean centerData = true;
        private int maxIter = 1;
        private double dampingExponent = DEFAULT_DAMPING_EXPONENT;
        private double samplesPerPeak = 5;
        private double nyquistFactor = 5;
        private boolean fallbackToIaaft;

        public Builder frequencyMethod(FrequencyMethod v) {
            this.frequencyMethod = v;
            return this;
        }

        public Builder normalization(Normalization v) {
            this.normalization = v;
            return this;
        }

        public Builder fitMean(boolean v) {
            this.fitMean = v;
            return this;
        }

        public Builder centerData(boolean v) {
            this.centerData = v;
            return this;
        }

        public Builder maxIter(int v) {
            this.maxIter = v;
            return this;
        }

        public Builder dampingExponent(double v) {
            this.dampingExponent = v;
            return this;
        }

        public Builder samplesPerPeak(double v) {
            this.samplesPerPeak = v;
            return this;
        }

        public Builder nyquistFactor(double v) {
            this.nyquistFactor = v;
            return this;
        }

        public Builder fallbackToIaaft(boolean v) {
            this.fallbackToIaaft = v;
            return this;
        }

        /**
         * @return validated configuration
         * @throws IllegalArgumentException if a value is out of range
         */
        public SpectralConfig build() {
            Objects.requireNonNull(frequencyMethod, "frequencyMethod required");
            Objects.requireNonNull(normalization, "normalization required");
            if (maxIter < 1) {
                throw new IllegalArgumentException("maxIter must be >= 1, got: " + maxIter);
            }
            if (!(dampingExponent > 0) || dampingExponent > 1) {
                throw new IllegalArgumentException("dampingExponent must be in (0, 1], got: " + dampingExponent);
            }
            if (!(samplesPerPeak > 0)) {
                throw new IllegalArgumentException("samplesPerPeak must be > 0, got: " + samplesPerPeak);
            }
            if (!(nyquistFactor > 0)) {
                throw new IllegalArgumentException("nyquistFactor must be > 0, got: " + nyquistFactor);
            }
            return new SpectralConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SpectralConfig{" +
                "frequencyMethod=" + frequencyMethod +
                ", normalization=" + normalization +
                ", fitMean=" + fitMean +
                ", centerData=" + centerData +
                ", maxIter=" + maxIter +
                ", dampingExponent=" + dampingExponent +
                ", fallbackToIaaft=" + fallbackToIaaft +
                '}';
    }
}
