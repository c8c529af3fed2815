package com.trendsentinel.core.config;

import com.trendsentinel.core.model.TimeSeries;

import java.io.Serializable;

/**
 * Imputation multipliers for censored values.
 *
 * <p>
 * A left-censored {@code <L} is imputed as {@code L × leftMultiplier} and a
 * right-censored {@code >L} as {@code L × rightMultiplier}.
 * </p>
 *
 * @since 1.0.0
 */
public final class CensoringConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_LEFT_MULTIPLIER = 0.5;
    public static final double DEFAULT_RIGHT_MULTIPLIER = 1.1;

    private static final CensoringConfig DEFAULTS = new Builder().build();

    private final double leftMultiplier;
    private final double rightMultiplier;

    private CensoringConfig(Builder b) {
        this.leftMultiplier = b.leftMultiplier;
        this.rightMultiplier = b.rightMultiplier;
    }

    public static CensoringConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getLeftMultiplier() {
        return leftMultiplier;
    }

    public double getRightMultiplier() {
        return rightMultiplier;
    }

    /**
     * Numeric stand-ins for the series values: left-censored limits scaled by
     * the left multiplier, right-censored limits by the right multiplier,
     * uncensored values unchanged.
     *
     * @param series the series
     * @return one imputed value per row
     */
    public double[] impute(TimeSeries series) {
        double[] x = series.values();
        for (int i = 0; i < x.length; i++) {
            x[i] = switch (series.kind(i)) {
                case LEFT -> x[i] * leftMultiplier;
                case RIGHT -> x[i] * rightMultiplier;
                case NONE -> x[i];
            };
        }
        return x;
    }

    /**
     * Fluent builder; {@link #build()} rejects non-positive or non-finite
     * multipliers.
     */
    public static class Builder {
        private double leftMultiplier = DEFAULT_LEFT_MULTIPLIER;
        private double rightMultiplier = DEFAULT_RIGHT_MULTIPLIER;

        public Builder leftMultiplier(double v) {
            this.leftMultiplier = v;
            return this;
        }

        public Builder rightMultiplier(double v) {
            this.rightMultiplier = v;
            return this;
        }

        public CensoringConfig build() {
            requirePositive(leftMultiplier, "leftMultiplier");
            requirePositive(rightMultiplier, "rightMultiplier");
            return new CensoringConfig(this);
        }

        private static void requirePositive(double value, String name) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(name + " must be a positive finite number, got: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "CensoringConfig{left=" + leftMultiplier + ", right=" + rightMultiplier + '}';
    }
}
