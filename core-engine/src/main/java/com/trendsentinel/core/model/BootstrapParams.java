package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.OptionalInt;

/**
 * Parameters of a moving-block bootstrap.
 *
 * <p>
 * A block size of {@code null} means "auto": the block length is derived
 * from the sample autocorrelation of the series.
 * </p>
 *
 * @since 1.0.0
 */
public final class BootstrapParams implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Integer blockSize;
    private final int nBootstrap;
    private final double alpha;

    private BootstrapParams(Builder b) {
        this.blockSize = b.blockSize;
        this.nBootstrap = b.nBootstrap;
        this.alpha = b.alpha;
    }

    /**
     * @param nBootstrap number of resamples
     * @return automatic block size, {@code alpha = 0.05}
     */
    public static BootstrapParams auto(int nBootstrap) {
        return new Builder().nBootstrap(nBootstrap).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return the fixed block size, or empty for automatic selection */
    public OptionalInt getBlockSize() {
        return blockSize == null ? OptionalInt.empty() : OptionalInt.of(blockSize);
    }

    public boolean isAutoBlockSize() {
        return blockSize == null;
    }

    public int getNBootstrap() {
        return nBootstrap;
    }

    /** @return two-sided level of the slope confidence interval */
    public double getAlpha() {
        return alpha;
    }

    /**
     * Fluent builder; {@link #build()} validates every value.
     */
    public static class Builder {
        private Integer blockSize;
        private int nBootstrap = 1000;
        private double alpha = 0.05;

        /**
         * @param blockSize fixed block length, or {@code null} for auto
         * @return this builder
         */
        public Builder blockSize(Integer blockSize) {
            this.blockSize = blockSize;
            return this;
        }

        public Builder autoBlockSize() {
            this.blockSize = null;
            return this;
        }

        public Builder nBootstrap(int nBootstrap) {
            this.nBootstrap = nBootstrap;
            return this;
        }

        public Builder alpha(double alpha) {
            this.alpha = alpha;
            return this;
        }

        /**
         * @return validated parameters
         * @throws IllegalArgumentException if {@code blockSize < 1},
         *                                  {@code nBootstrap <= 0} or
         *                                  {@code alpha} is outside (0, 1)
         */
        public BootstrapParams build() {
            if (blockSize != null && blockSize < 1) {
                throw new IllegalArgumentException("blockSize must be >= 1 or auto, got: " + blockSize);
            }
            if (nBootstrap <= 0) {
                throw new IllegalArgumentException("nBootstrap must be > 0, got: " + nBootstrap);
            }
            if (!(alpha > 0 && alpha < 1)) {
                throw new IllegalArgumentException("alpha must be in (0, 1), got: " + alpha);
            }
            return new BootstrapParams(this);
        }
    }

    @Override
    public String toString() {
        return "BootstrapParams{blockSize=" + (blockSize == null ? "auto" : blockSize)
                + ", nBootstrap=" + nBootstrap + ", alpha=" + alpha + '}';
    }
}
