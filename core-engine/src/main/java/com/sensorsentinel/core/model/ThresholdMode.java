package com.sensorsentinel.core.model;

import com.sensorsentinel.core.ValidationException;

import java.util.Locale;

/**
 * Named threshold presets plus the operator-editable {@link #CUSTOM} mode.
 *
 * @since 1.0.0
 */
public enum ThresholdMode {
    RELAXED,
    NORMAL,
    RESTRICTED,
    CUSTOM;

    /**
     * @return lowercase name used for persistence, e.g. {@code "normal"}
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a mode name, ignoring case and surrounding whitespace.
     *
     * @param name mode name such as {@code "relaxed"}
     * @return the matching mode
     * @throws ValidationException if the name is blank or unknown
     */
    public static ThresholdMode fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Threshold mode must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown threshold mode: '" + name
                    + "'. Supported: relaxed, normal, restricted, custom", e);
        }
    }
}
