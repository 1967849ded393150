package com.sensorsentinel.core.config;

import com.sensorsentinel.core.model.ThresholdMode;
import com.sensorsentinel.core.model.ThresholdSet;

import java.util.Objects;

/**
 * The fixed threshold sets behind the named modes, plus the template the
 * custom set starts from.
 *
 * @since 1.0.0
 */
public final class ThresholdPresets {

    private static final ThresholdPresets STANDARD = new ThresholdPresets(
            ThresholdSet.RELAXED, ThresholdSet.NORMAL, ThresholdSet.RESTRICTED, ThresholdSet.DEFAULT);

    private final ThresholdSet relaxed;
    private final ThresholdSet normal;
    private final ThresholdSet restricted;
    private final ThresholdSet customTemplate;

    public ThresholdPresets(ThresholdSet relaxed, ThresholdSet normal,
            ThresholdSet restricted, ThresholdSet customTemplate) {
        this.relaxed = Objects.requireNonNull(relaxed, "relaxed must not be null");
        this.normal = Objects.requireNonNull(normal, "normal must not be null");
        this.restricted = Objects.requireNonNull(restricted, "restricted must not be null");
        this.customTemplate = Objects.requireNonNull(customTemplate, "customTemplate must not be null");
    }

    /**
     * @return the built-in presets
     */
    public static ThresholdPresets standard() {
        return STANDARD;
    }

    /**
     * @param mode a named mode
     * @return the fixed set for {@code mode}
     * @throws IllegalArgumentException for {@link ThresholdMode#CUSTOM}, which
     *                                  has no fixed set
     */
    public ThresholdSet forMode(ThresholdMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        return switch (mode) {
            case RELAXED -> relaxed;
            case NORMAL -> normal;
            case RESTRICTED -> restricted;
            case CUSTOM -> throw new IllegalArgumentException(
                    "Custom mode has no fixed threshold set");
        };
    }

    /**
     * @return the initial custom thresholds, also used when persisted custom
     *         values are missing or corrupt
     */
    public ThresholdSet customTemplate() {
        return customTemplate;
    }

    @Override
    public String toString() {
        return "ThresholdPresets{" +
                "relaxed=" + relaxed +
                ", normal=" + normal +
                ", restricted=" + restricted +
                ", customTemplate=" + customTemplate +
                '}';
    }
}
