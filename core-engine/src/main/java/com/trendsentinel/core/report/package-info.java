/**
 * JSON rendering of test and power results.
 *
 * <p>
 * NaN values, such as a minimum detectable trend that was never reached, are
 * written as the string {@code "NaN"}.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.report;
