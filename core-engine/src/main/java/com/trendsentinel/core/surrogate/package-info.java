/**
 * Colored-noise surrogates and the surrogate significance test.
 *
 * <p>
 * {@link com.trendsentinel.core.surrogate.IaaftGenerator} serves evenly
 * sampled series and
 * {@link com.trendsentinel.core.surrogate.SpectralSynthesisGenerator}
 * unevenly sampled ones;
 * {@link com.trendsentinel.core.surrogate.SurrogateSignificanceTester} picks
 * between them and turns the ensemble into a p-value.
 * </p>
 *
 * <h3>Censoring</h3>
 * <p>
 * Censored values are imputed before synthesis, and
 * {@link com.trendsentinel.core.surrogate.CensoringPropagator} carries the
 * censoring back onto each realization by rank.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.surrogate;
