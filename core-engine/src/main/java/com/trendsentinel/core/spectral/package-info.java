/**
 * Spectral estimation for surrogate synthesis.
 *
 * <p>
 * {@link com.trendsentinel.core.spectral.Dft} handles evenly sampled series of
 * any length. Unevenly sampled series go through a
 * {@link com.trendsentinel.core.spectral.PeriodogramProvider}, with
 * {@link com.trendsentinel.core.spectral.LombScarglePeriodogram} as the
 * built-in one.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.spectral;
