package com.trendsentinel.core.stats;

import org.apache.commons.math3.stat.StatUtils;

import java.util.Objects;

/**
 * Sample autocorrelation function.
 *
 * @since 1.0.0
 */
public final class Autocorrelation {

    private Autocorrelation() {
        // utility class, not instantiable
    }

    /**
     * Biased sample ACF for lags {@code 0..maxLag}.
     *
     * <p>
     * A zero-variance series has {@code acf[0] = 1} and zero at every other
     * lag.
     * </p>
     *
     * @param values series in time order
     * @param maxLag largest lag, clamped to {@code values.length - 1}
     * @return autocorrelations, {@code acf[0] == 1}
     */
    public static double[] acf(double[] values, int maxLag) {
        Objects.requireNonNull(values, "values must not be null");
        if (maxLag < 0) {
            throw new IllegalArgumentException("maxLag must be >= 0, got: " + maxLag);
        }
        int n = values.length;
        int lags = Math.min(maxLag, Math.max(n - 1, 0));
        double[] acf = new double[lags + 1];
        acf[0] = 1.0;
        if (n < 2) {
            return acf;
        }

        double mean = StatUtils.mean(values);
        double denominator = 0;
        for (double v : values) {
            denominator += (v - mean) * (v - mean);
        }
        if (denominator == 0) {
            return acf;
        }
        for (int lag = 1; lag <= lags; lag++) {
            double sum = 0;
            for (int i = 0; i + lag < n; i++) {
                sum += (values[i] - mean) * (values[i + lag] - mean);
            }
            acf[lag] = sum / denominator;
        }
        return acf;
    }
}
