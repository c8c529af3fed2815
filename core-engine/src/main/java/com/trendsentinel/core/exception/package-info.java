/**
 * Exceptions specific to trend analysis.
 *
 * <p>
 * Invalid arguments are reported with {@link java.lang.IllegalArgumentException}
 * and invalid configuration with {@link java.lang.IllegalStateException}; the
 * classes here cover the remaining hard failures.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.exception;
