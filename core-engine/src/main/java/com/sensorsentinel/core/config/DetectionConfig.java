package com.sensorsentinel.core.config;

import com.sensorsentinel.core.ValidationException;
import com.sensorsentinel.core.model.ThresholdMode;
import com.sensorsentinel.core.model.ThresholdSet;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Top-level POJO for the detection engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional):
 * </p>
 *
 * <pre>
 * ewmaAlpha: 0.1
 * ewmaLambda: 0.94
 * hampelWindow: 7
 * contextRadius: 5
 * presets:
 *   normal:
 *     zScore: 2.7
 *     rate: 15
 * </pre>
 *
 * <p>
 * Preset names are {@code relaxed}, {@code normal}, {@code restricted} and
 * {@code default} (the template for custom thresholds). Detectors missing from
 * a preset keep their built-in value. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Preset name for the custom-threshold template. */
    public static final String DEFAULT_PRESET = "default";

    private double ewmaAlpha = 0.1;
    private double ewmaLambda = 0.94;
    private int hampelWindow = 7;
    private int contextRadius = 5;
    private Map<String, Map<String, Number>> presets = new LinkedHashMap<>();

    /**
     * @return configuration with every built-in default
     */
    public static DetectionConfig defaults() {
        return new DetectionConfig();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting, collecting all problems into one exception.
     *
     * @throws IllegalStateException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(ewmaAlpha > 0 && ewmaAlpha <= 1)) {
            errors.add("'ewmaAlpha' must be in (0, 1], got: " + ewmaAlpha);
        }
        if (!(ewmaLambda > 0 && ewmaLambda <= 1)) {
            errors.add("'ewmaLambda' must be in (0, 1], got: " + ewmaLambda);
        }
        if (hampelWindow < 1) {
            errors.add("'hampelWindow' must be >= 1, got: " + hampelWindow);
        }
        if (contextRadius < 0) {
            errors.add("'contextRadius' must be >= 0, got: " + contextRadius);
        }

        for (Map.Entry<String, Map<String, Number>> entry : presets.entrySet()) {
            String name = entry.getKey();
            if (!isKnownPreset(name)) {
                errors.add("Unknown preset: '" + name
                        + "'. Supported: relaxed, normal, restricted, default");
                continue;
            }
            try {
                ThresholdSet.fromMap(entry.getValue(), ThresholdSet.DEFAULT);
            } catch (ValidationException e) {
                errors.add("Preset '" + name + "': " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detection configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Resolve the threshold presets, overlaying configured values on the
     * built-in ones.
     *
     * @return the presets to hand to a threshold store
     * @throws ValidationException if a configured preset is invalid
     */
    public ThresholdPresets toPresets() {
        ThresholdPresets builtIn = ThresholdPresets.standard();
        return new ThresholdPresets(
                overlay(ThresholdMode.RELAXED.key(), builtIn.forMode(ThresholdMode.RELAXED)),
                overlay(ThresholdMode.NORMAL.key(), builtIn.forMode(ThresholdMode.NORMAL)),
                overlay(ThresholdMode.RESTRICTED.key(), builtIn.forMode(ThresholdMode.RESTRICTED)),
                overlay(DEFAULT_PRESET, builtIn.customTemplate()));
    }

    private ThresholdSet overlay(String presetName, ThresholdSet builtIn) {
        for (Map.Entry<String, Map<String, Number>> entry : presets.entrySet()) {
            if (entry.getKey() != null && entry.getKey().toLowerCase(Locale.ROOT).equals(presetName)) {
                return ThresholdSet.fromMap(entry.getValue(), builtIn);
            }
        }
        return builtIn;
    }

    private static boolean isKnownPreset(String name) {
        if (name == null) {
            return false;
        }
        String normalised = name.toLowerCase(Locale.ROOT);
        return normalised.equals(DEFAULT_PRESET)
                || normalised.equals(ThresholdMode.RELAXED.key())
                || normalised.equals(ThresholdMode.NORMAL.key())
                || normalised.equals(ThresholdMode.RESTRICTED.key());
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getEwmaAlpha() {
        return ewmaAlpha;
    }

    public void setEwmaAlpha(double ewmaAlpha) {
        this.ewmaAlpha = ewmaAlpha;
    }

    public double getEwmaLambda() {
        return ewmaLambda;
    }

    public void setEwmaLambda(double ewmaLambda) {
        this.ewmaLambda = ewmaLambda;
    }

    public int getHampelWindow() {
        return hampelWindow;
    }

    public void setHampelWindow(int hampelWindow) {
        this.hampelWindow = hampelWindow;
    }

    public int getContextRadius() {
        return contextRadius;
    }

    public void setContextRadius(int contextRadius) {
        this.contextRadius = contextRadius;
    }

    /**
     * @return unmodifiable view of the configured preset overrides
     */
    public Map<String, Map<String, Number>> getPresets() {
        return Collections.unmodifiableMap(presets);
    }

    /**
     * Set the preset overrides (used by SnakeYAML during deserialization).
     */
    public void setPresets(Map<String, Map<String, Number>> presets) {
        this.presets = presets != null ? new LinkedHashMap<>(presets) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "ewmaAlpha=" + ewmaAlpha +
                ", ewmaLambda=" + ewmaLambda +
                ", hampelWindow=" + hampelWindow +
                ", contextRadius=" + contextRadius +
                ", presets=" + presets.keySet() +
                '}';
    }
}
