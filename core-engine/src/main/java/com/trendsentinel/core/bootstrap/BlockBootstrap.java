package com.trendsentinel.core.bootstrap;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.Objects;

/**
 * Moving-block bootstrap primitives.
 *
 * @since 1.0.0
 */
public final class BlockBootstrap {

    /** Autocorrelation below which two observations count as decorrelated. */
    public static final double DECORRELATION_THRESHOLD = 0.1;

    /** Smallest block length chosen automatically. */
    public static final int MIN_AUTO_BLOCK = 3;

    private BlockBootstrap() {
        // utility class, not instantiable
    }

    /**
     * Block length from the correlation length {@code L}: the first lag whose
     * |ACF| is below {@value #DECORRELATION_THRESHOLD}, or 1 if there is none.
     * The result is {@code 2L} capped at {@code ceil(sqrt(n))} and floored at
     * {@value #MIN_AUTO_BLOCK}; the floor wins when the two conflict.
     *
     * @param n   series length
     * @param acf sample autocorrelations, {@code acf[0] == 1}
     * @return block length, at least {@value #MIN_AUTO_BLOCK}
     */
    public static int optimalBlockSize(int n, double[] acf) {
        Objects.requireNonNull(acf, "acf must not be null");
        int correlationLength = 1;
        for (int lag = 1; lag < acf.length; lag++) {
            if (Math.abs(acf[lag]) < DECORRELATION_THRESHOLD) {
                correlationLength = lag;
                break;
            }
        }
        int cap = (int) Math.ceil(Math.sqrt(n));
        return Math.max(Math.min(2 * correlationLength, cap), MIN_AUTO_BLOCK);
    }

    /**
     * Indices of one moving-block resample: {@code ceil(n / blockSize)}
     * blocks with starts drawn uniformly from {@code [0, n - blockSize]},
     * concatenated and truncated to {@code n}.
     *
     * @param n         series length
     * @param blockSize block length, {@code >= 1}; {@code >= n} yields the identity
     * @param rng       random source
     * @return {@code n} indices into the series
     */
    public static int[] resampleIndices(int n, int blockSize, RandomGenerator rng) {
        if (blockSize < 1) {
            throw new IllegalArgumentException("blockSize must be >= 1, got: " + blockSize);
        }
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got: " + n);
        }
        Objects.requireNonNull(rng, "rng must not be null");
        int[] indices = new int[n];
        if (blockSize >= n) {
            for (int i = 0; i < n; i++) {
                indices[i] = i;
            }
            return indices;
        }
        int startBound = n - blockSize + 1;
        int filled = 0;
        while (filled < n) {
            int start = rng.nextInt(startBound);
            for (int j = 0; j < blockSize && filled < n; j++) {
                indices[filled++] = start + j;
            }
        }
        return indices;
    }
}
