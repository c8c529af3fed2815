package com.trendsentinel.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Time unit in which a trend slope is expressed by the caller.
 *
 * <p>
 * Series times are read as seconds whenever a unit other than {@link #NONE}
 * is used. {@link #NONE} passes slopes through unchanged, i.e. they are
 * already in value per time-axis unit.
 * </p>
 *
 * @since 1.0.0
 */
public enum SlopeUnit {
    NONE(1.0),
    SECOND(1.0),
    MINUTE(60.0),
    HOUR(3_600.0),
    DAY(86_400.0),
    WEEK(604_800.0),
    /** Mean Julian month, 30.4375 days. */
    MONTH(2_629_800.0),
    /** Julian year, 365.25 days. */
    YEAR(31_557_600.0);

    private final double seconds;

    SlopeUnit(double seconds) {
        this.seconds = seconds;
    }

    /**
     * @return length of one unit in seconds (1 for {@link #NONE})
     */
    public double getSeconds() {
        return seconds;
    }

    /**
     * Convert a slope expressed per this unit into value per second.
     *
     * @param slopePerUnit slope in caller units
     * @return slope in value per second ({@code slopePerUnit} for
     *         {@link #NONE})
     */
    public double toPerSecond(double slopePerUnit) {
        return slopePerUnit / seconds;
    }

    /**
     * Parse a unit name, case-insensitive; plural forms are accepted.
     *
     * @param value unit name, {@code null} meaning {@link #NONE}
     * @return the matching unit
     * @throws IllegalArgumentException if the name is not a known unit
     */
    public static SlopeUnit fromString(String value) {
        if (value == null) {
            return NONE;
        }
        String key = value.trim().toUpperCase(Locale.ROOT);
        if (key.endsWith("S") && key.length() > 1) {
            key = key.substring(0, key.length() - 1);
        }
        for (SlopeUnit unit : values()) {
            if (unit.name().equals(key)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown slope unit: '" + value + "'. Supported units: "
                + Arrays.stream(values())
                        .map(u -> u.name().toLowerCase(Locale.ROOT))
                        .collect(Collectors.joining(", ")));
    }
}
