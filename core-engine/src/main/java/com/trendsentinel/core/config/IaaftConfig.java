package com.trendsentinel.core.config;

import java.io.Serializable;

/**
 * Typed configuration of the IAAFT surrogate generator.
 *
 * @since 1.0.0
 */
public final class IaaftConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_MAX_ITER = 100;
    public static final double DEFAULT_TOLERANCE = 1e-6;

    private static final IaaftConfig DEFAULTS = new Builder().build();

    private final int maxIter;
    private final double tolerance;

    private IaaftConfig(Builder b) {
        this.maxIter = b.maxIter;
        this.tolerance = b.tolerance;
    }

    public static IaaftConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return upper bound on spectrum/rank alternations per realization */
    public int getMaxIter() {
        return maxIter;
    }

    /** @return convergence threshold on the variance-normalised mean squared change */
    public double getTolerance() {
        return tolerance;
    }

    /**
     * Fluent builder for {@link IaaftConfig}.
     */
    public static class Builder {
        private int maxIter = DEFAULT_MAX_ITER;
        private double tolerance = DEFAULT_TOLERANCE;

        public Builder maxIter(int v) {
            this.maxIter = v;
            return this;
        }

        public Builder tolerance(double v) {
            this.tolerance = v;
            return this;
        }

        /**
         * @return validated configuration
         * @throws IllegalArgumentException if {@code maxIter < 1} or the
         *                                  tolerance is not positive
         */
        public IaaftConfig build() {
            if (maxIter < 1) {
                throw new IllegalArgumentException("maxIter must be >= 1, got: " + maxIter);
            }
            if (!(tolerance > 0)) {
                throw new IllegalArgumentException("tolerance must be > 0, got: " + tolerance);
            }
            return new IaaftConfig(this);
        }
    }

    @Override
    public String toString() {
        return "IaaftConfig{maxIter=" + maxIter + ", tolerance=" + tolerance + '}';
    }
}
