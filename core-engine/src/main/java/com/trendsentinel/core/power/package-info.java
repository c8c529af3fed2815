/**
 * Monte Carlo power and minimum detectable trend.
 *
 * <p>
 * {@link com.trendsentinel.core.power.PowerAnalyzer} injects known slopes into
 * colored-noise realizations of a template series and counts how often the
 * surrogate test detects them. Simulations run on a worker pool, each with
 * its own derived seed, and can be aborted between simulations.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.power;
