package com.trendsentinel.core.config;

import com.trendsentinel.core.model.SlopeUnit;
import com.trendsentinel.core.model.SurrogateMethod;

import java.io.Serializable;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Typed configuration of a Monte Carlo power analysis.
 *
 * <p>
 * Immutable; constructed exclusively through {@link Builder}, which validates
 * every value in {@link Builder#build()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PowerConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_N_SIMULATIONS = 100;
    public static final int DEFAULT_N_SURROGATES_INNER = 1000;
    public static final double DEFAULT_ALPHA = 0.05;

    private final int nSimulations;
    private final int nSurrogatesInner;
    private final double alpha;
    private final SlopeUnit slopeUnit;
    private final boolean detrendInput;
    private final SurrogateMethod method;
    private final int parallelism;
    private final Long seed;

    private PowerConfig(Builder b) {
        this.nSimulations = b.nSimulations;
        this.nSurrogatesInner = b.nSurrogatesInner;
        this.alpha = b.alpha;
        this.slopeUnit = b.slopeUnit;
        this.detrendInput = b.detrendInput;
        this.method = b.method;
        this.parallelism = b.parallelism;
        this.seed = b.seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return noise realizations per candidate slope */
    public int getNSimulations() {
        return nSimulations;
    }

    /** @return surrogates per inner significance test */
    public int getNSurrogatesInner() {
        return nSurrogatesInner;
    }

    public double getAlpha() {
        return alpha;
    }

    public SlopeUnit getSlopeUnit() {
        return slopeUnit;
    }

    /** @return whether the least-squares line is removed before building the noise model */
    public boolean isDetrendInput() {
        return detrendInput;
    }

    public SurrogateMethod getMethod() {
        return method;
    }

    public int getParallelism() {
        return parallelism;
    }

    /** @return root seed, empty for a non-reproducible run */
    public OptionalLong getSeed() {
        return seed != null ? OptionalLong.of(seed) : OptionalLong.empty();
    }

    /**
     * Fluent builder for {@link PowerConfig}.
     */
    public static class Builder {
        private int nSimulations = DEFAULT_N_SIMULATIONS;
        private int nSurrogatesInner = DEFAULT_N_SURROGATES_INNER;
        private double alpha = DEFAULT_ALPHA;
        private SlopeUnit slopeUnit = SlopeUnit.NONE;
        private boolean detrendInput = true;
        private SurrogateMethod method = SurrogateMethod.AUTO;
        private int parallelism = 1;
        private Long seed;

        public Builder nSimulations(int v) {
            this.nSimulations = v;
            return this;
        }

        public Builder nSurrogatesInner(int v) {
            this.nSurrogatesInner = v;
            return this;
        }

        public Builder alpha(double v) {
            this.alpha = v;
            return this;
        }

        public Builder slopeUnit(SlopeUnit v) {
            this.slopeUnit = v;
            return this;
        }

        /** Convenience overload; rejects unknown unit names. */
        public Builder slopeUnit(String v) {
            this.slopeUnit = SlopeUnit.fromString(v);
            return this;
        }

        public Builder detrendInput(boolean v) {
            this.detrendInput = v;
            return this;
        }

        public Builder method(SurrogateMethod v) {
            this.method = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder seed(long v) {
            this.seed = v;
            return this;
        }

        public Builder randomSeed() {
            this.seed = null;
            return this;
        }

        /**
         * @return validated configuration
         * @throws IllegalArgumentException if a value is out of range
         */
        public PowerConfig build() {
            Objects.requireNonNull(slopeUnit, "slopeUnit required");
            Objects.requireNonNull(method, "method required");
            if (nSimulations <= 0) {
                throw new IllegalArgumentException("nSimulations must be > 0, got: " + nSimulations);
            }
            if (nSurrogatesInner <= 0) {
                throw new IllegalArgumentException("nSurrogatesInner must be > 0, got: " + nSurrogatesInner);
            }
            if (!(alpha > 0 && alpha < 1)) {
                throw new IllegalArgumentException("alpha must be in (0, 1), got: " + alpha);
            }
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be > 0, got: " + parallelism);
            }
            return new PowerConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PowerConfig{" +
                "nSimulations=" + nSimulations +
                ", nSurrogatesInner=" + nSurrogatesInner +
                ", alpha=" + alpha +
                ", slopeUnit=" + slopeUnit +
                ", detrendInput=" + detrendInput +
                ", method=" + method +
                ", parallelism=" + parallelism +
                ", seed=" + seed +
                '}';
    }
}
