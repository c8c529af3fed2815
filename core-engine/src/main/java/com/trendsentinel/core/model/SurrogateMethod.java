package com.trendsentinel.core.model;

import java.util.Locale;

/**
 * Surrogate generation method.
 *
 * <ul>
 * <li>{@link #AUTO}: IAAFT for uniform sampling, spectral synthesis
 * otherwise</li>
 * <li>{@link #IAAFT}: Iterated Amplitude Adjusted Fourier Transform</li>
 * <li>{@link #SPECTRAL}: periodogram-based spectral synthesis for irregular
 * sampling</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum SurrogateMethod {
    AUTO,
    IAAFT,
    SPECTRAL;

    /**
     * Parse a method name. {@code "lomb_scargle"} is accepted as an alias of
     * {@link #SPECTRAL}.
     *
     * @param value method name
     * @return the matching method
     * @throws IllegalArgumentException if the name is not recognised
     */
    public static SurrogateMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Surrogate method must not be null or blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "iaaft" -> IAAFT;
            case "spectral", "lomb_scargle", "lomb-scargle" -> SPECTRAL;
            default -> throw new IllegalArgumentException(
                    "Unknown surrogate method: '" + value + "'. Supported: auto, iaaft, spectral");
        };
    }
}
