package com.trendsentinel.core.model;

import java.io.Serializable;

/**
 * Percentile bootstrap confidence interval of a trend slope.
 *
 * @since 1.0.0
 */
public final class SlopeConfidenceInterval implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double slope;
    private final double lower;
    private final double upper;
    private final double alpha;
    private final double[] bootstrapSlopes;
    private final int blockSize;

    public SlopeConfidenceInterval(double slope, double lower, double upper, double alpha,
                                   double[] bootstrapSlopes, int blockSize) {
        this.slope = slope;
        this.lower = lower;
        this.upper = upper;
        this.alpha = alpha;
        this.bootstrapSlopes = bootstrapSlopes.clone();
        this.blockSize = blockSize;
    }

    /** @return the observed slope */
    public double getSlope() {
        return slope;
    }

    /** @return the {@code alpha/2} percentile of the bootstrap slopes */
    public double getLower() {
        return lower;
    }

    /** @return the {@code 1 - alpha/2} percentile of the bootstrap slopes */
    public double getUpper() {
        return upper;
    }

    public double getAlpha() {
        return alpha;
    }

    public double[] getBootstrapSlopes() {
        return bootstrapSlopes.clone();
    }

    public int getBlockSize() {
        return blockSize;
    }

    @Override
    public String toString() {
        return "SlopeConfidenceInterval{slope=" + slope + ", lower=" + lower + ", upper=" + upper
                + ", alpha=" + alpha + ", blockSize=" + blockSize + '}';
    }
}
