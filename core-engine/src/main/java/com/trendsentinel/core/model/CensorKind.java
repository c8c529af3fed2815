package com.trendsentinel.core.model;

import java.util.Locale;

/**
 * Censoring kind of a single observation.
 *
 * <ul>
 * <li>{@link #NONE}: an exact measurement</li>
 * <li>{@link #LEFT}: only known to be below the recorded limit
 * ({@code "<5"})</li>
 * <li>{@link #RIGHT}: only known to be above the recorded limit
 * ({@code ">5"})</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum CensorKind {
    NONE,
    LEFT,
    RIGHT;

    /**
     * Parse a censoring kind, accepting the short forms used in water-quality
     * data sets ({@code "not"}, {@code "lt"}, {@code "gt"}) as well as the
     * constant names.
     *
     * @param value the textual kind; must not be {@code null}
     * @return the matching kind
     * @throws IllegalArgumentException if the value is not recognised
     */
    public static CensorKind fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Censor kind must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "none", "not", "" -> NONE;
            case "left", "lt", "<" -> LEFT;
            case "right", "gt", ">" -> RIGHT;
            default -> throw new IllegalArgumentException(
                    "Unknown censor kind: '" + value + "'. Supported: none/not, left/lt, right/gt");
        };
    }
}
