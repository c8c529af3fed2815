package com.trendsentinel.core.surrogate;

import java.util.Objects;

/**
 * Classifies sampling as uniform or irregular.
 *
 * @since 1.0.0
 */
public final class SamplingInspector {

    /** Relative tolerance on each time step against the first one. */
    public static final double RELATIVE_TOLERANCE = 1e-3;

    private static final double ABSOLUTE_TOLERANCE = 1e-8;

    private SamplingInspector() {
    }

    /**
     * @param times sampling times in series order
     * @return {@code true} if every successive step is within
     *         {@value #RELATIVE_TOLERANCE} (relative) of the first step
     */
    public static boolean isUniform(double[] times) {
        Objects.requireNonNull(times, "times must not be null");
        if (times.length < 3) {
            return true;
        }
        double first = times[1] - times[0];
        double bound = ABSOLUTE_TOLERANCE + RELATIVE_TOLERANCE * Math.abs(first);
        for (int i = 2; i < times.length; i++) {
            if (Math.abs((times[i] - times[i - 1]) - first) > bound) {
                return false;
            }
        }
        return true;
    }
}
