package com.trendsentinel.core.spectral;

import java.util.Locale;

/**
 * Frequency grid used for the reference periodogram.
 *
 * @since 1.0.0
 */
public enum FrequencyMethod {
    /** Linear grid oversampled by {@code samplesPerPeak} up to a multiple of the mean Nyquist frequency. */
    AUTO,
    /** {@code 2n} log-spaced frequencies from {@code 1/baseline} to the approximate Nyquist frequency. */
    LOG;

    public static FrequencyMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Frequency method must not be null or blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "log" -> LOG;
            default -> throw new IllegalArgumentException(
                    "Unknown frequency method: '" + value + "'. Supported: auto, log");
        };
    }
}
