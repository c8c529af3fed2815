/**
 * Reproducible seeding.
 *
 * <p>
 * {@link com.trendsentinel.core.random.SeedSequence} derives one independent
 * seed per realization or simulation from a single root, so results do not
 * depend on thread scheduling.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.random;
