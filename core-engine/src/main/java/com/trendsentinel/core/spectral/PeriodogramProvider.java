package com.trendsentinel.core.spectral;

import com.trendsentinel.core.config.SpectralConfig;

/**
 * Computes a periodogram of unevenly sampled data.
 *
 * <p>
 * Spectral-synthesis surrogates are only available when a provider is
 * supplied. Implementations must be pure and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public interface PeriodogramProvider {

    /**
     * Frequency grid for the given sampling times.
     *
     * @param times  sampling times
     * @param config grid selection
     * @return strictly positive frequencies, in cycles per time unit
     */
    double[] frequencyGrid(double[] times, SpectralConfig config);

    /**
     * Power of {@code values} at each of {@code frequencies}.
     *
     * @param times       sampling times
     * @param values      observations
     * @param dy          per-observation uncertainties, or {@code null} for unit weights
     * @param frequencies evaluation grid
     * @param config      normalization and mean handling
     * @return one power value per frequency
     */
    Periodogram compute(double[] times, double[] values, double[] dy,
                        double[] frequencies, SpectralConfig config);
}
