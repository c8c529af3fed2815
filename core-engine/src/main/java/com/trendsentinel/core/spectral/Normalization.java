package com.trendsentinel.core.spectral;

import java.util.Locale;

/**
 * Lomb-Scargle power normalization.
 *
 * @since 1.0.0
 */
public enum Normalization {
    /** Fraction of variance explained, in [0, 1]. */
    STANDARD,
    /** Explained over residual chi-square. */
    MODEL,
    /** {@code -ln(1 - standard)}. */
    LOG,
    /** Unnormalized power spectral density. */
    PSD;

    public static Normalization fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Normalization must not be null or blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "standard" -> STANDARD;
            case "model" -> MODEL;
            case "log" -> LOG;
            case "psd" -> PSD;
            default -> throw new IllegalArgumentException(
                    "Unknown normalization: '" + value + "'. Supported: standard, model, log, psd");
        };
    }
}
