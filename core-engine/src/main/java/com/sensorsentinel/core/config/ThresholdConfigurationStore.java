package com.sensorsentinel.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorsentinel.core.ValidationException;
import com.sensorsentinel.core.model.DetectorKind;
import com.sensorsentinel.core.model.ThresholdMode;
import com.sensorsentinel.core.model.ThresholdSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds the selected {@link ThresholdMode} and the operator-editable custom
 * {@link ThresholdSet}, and exposes the set the pipeline should use.
 *
 * <h3>State</h3>
 * <p>
 * Starts in the persisted mode with the persisted custom values. Each key
 * falls back on its own: an unreadable mode gives {@link ThresholdMode#NORMAL},
 * unreadable custom values give the preset custom template, both with a
 * warning. Custom values are kept when
 * switching away from {@link ThresholdMode#CUSTOM} and back.
 * </p>
 *
 * <h3>Persistence</h3>
 * <p>
 * Every successful change is written through the injected
 * {@link KeyValueStore}: the mode name under {@value #MODE_KEY} and the
 * custom set as JSON under {@value #CUSTOM_KEY}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Mutations are serialized. Mode and custom values are published together as
 * one immutable snapshot, so {@link #activeThresholds()} never observes a
 * half-applied change.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdConfigurationStore {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdConfigurationStore.class);

    public static final String MODE_KEY = "thresholdMode";
    public static final String CUSTOM_KEY = "customThresholds";

    private final KeyValueStore persistence;
    private final ThresholdPresets presets;
    private final ObjectMapper mapper = new ObjectMapper();

    private volatile Snapshot current;

    public ThresholdConfigurationStore(KeyValueStore persistence) {
        this(persistence, ThresholdPresets.standard());
    }

    /**
     * @param persistence where mode and custom values are read from and written
     *                    to; must not be {@code null}
     * @param presets     fixed sets behind the named modes; must not be
     *                    {@code null}
     */
    public ThresholdConfigurationStore(KeyValueStore persistence, ThresholdPresets presets) {
        this.persistence = Objects.requireNonNull(persistence, "persistence must not be null");
        this.presets = Objects.requireNonNull(presets, "presets must not be null");
        this.current = new Snapshot(loadMode(), loadCustom());
        LOG.info("Threshold store initialised: mode={} active={}", current.mode.key(), activeThresholds());
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * @return the custom set in {@link ThresholdMode#CUSTOM}, otherwise the
     *         fixed set of the selected mode
     */
    public ThresholdSet activeThresholds() {
        Snapshot snapshot = current;
        return snapshot.mode == ThresholdMode.CUSTOM
                ? snapshot.custom
                : presets.forMode(snapshot.mode);
    }

    public ThresholdMode getMode() {
        return current.mode;
    }

    public ThresholdSet getCustomThresholds() {
        return current.custom;
    }

    // ---------------------------------------------------------------
    // Mutations
    // ---------------------------------------------------------------

    /**
     * Make {@code mode} the active mode. Selecting the current mode again
     * changes nothing.
     *
     * @param mode mode to activate; must not be {@code null}
     */
    public synchronized void selectMode(ThresholdMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        Snapshot snapshot = current;
        if (snapshot.mode == mode) {
            return;
        }
        persistence.setString(MODE_KEY, mode.key());
        // published only after a successful write
        current = new Snapshot(mode, snapshot.custom);
        LOG.info("Threshold mode changed: {} -> {}", snapshot.mode.key(), mode.key());
    }

    /**
     * @param modeName mode name, case-insensitive
     * @throws ValidationException if the name is not a known mode
     */
    public void selectMode(String modeName) {
        selectMode(ThresholdMode.fromName(modeName));
    }

    /**
     * Overwrite one custom threshold from operator input.
     *
     * @param kind     detector whose threshold changes
     * @param rawInput operator input; must be a plain decimal number &gt; 0
     * @return the updated custom set
     * @throws IllegalStateException if the store is not in custom mode
     * @throws ValidationException   if the input is not a positive number; the
     *                               previous value is kept
     */
    public synchronized ThresholdSet updateCustomThreshold(DetectorKind kind, String rawInput) {
        Objects.requireNonNull(kind, "kind must not be null");
        requireCustomMode();
        return updateCustomThreshold(kind, parseThreshold(kind, rawInput));
    }

    /**
     * Overwrite one custom threshold.
     *
     * @throws IllegalStateException if the store is not in custom mode
     * @throws ValidationException   if {@code value} is not a finite number
     *                               &gt; 0; the previous value is kept
     */
    public synchronized ThresholdSet updateCustomThreshold(DetectorKind kind, double value) {
        Objects.requireNonNull(kind, "kind must not be null");
        requireCustomMode();
        Snapshot snapshot = current;
        ThresholdSet updated = snapshot.custom.with(kind, value);
        persistence.setString(CUSTOM_KEY, toJson(updated));
        current = new Snapshot(snapshot.mode, updated);
        LOG.info("Custom threshold '{}' set to {}", kind.key(), value);
        return updated;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void requireCustomMode() {
        if (current.mode != ThresholdMode.CUSTOM) {
            throw new IllegalStateException(
                    "Custom thresholds can only be edited in custom mode (current: "
                            + current.mode.key() + ")");
        }
    }

    private static double parseThreshold(DetectorKind kind, String rawInput) {
        if (rawInput == null || rawInput.isBlank()) {
            throw new ValidationException("Threshold '" + kind.key() + "' must not be blank");
        }
        try {
            return new BigDecimal(rawInput.trim()).doubleValue();
        } catch (NumberFormatException e) {
            throw new ValidationException(
                    "Threshold '" + kind.key() + "' is not a number: '" + rawInput + "'", e);
        }
    }

    private ThresholdMode loadMode() {
        Optional<String> stored = persistence.getString(MODE_KEY);
        if (stored.isEmpty()) {
            return ThresholdMode.NORMAL;
        }
        try {
            return ThresholdMode.fromName(stored.get());
        } catch (ValidationException e) {
            LOG.warn("Ignoring stored threshold mode – falling back to normal: {}", e.getMessage());
            return ThresholdMode.NORMAL;
        }
    }

    private ThresholdSet loadCustom() {
        Optional<String> stored = persistence.getString(CUSTOM_KEY);
        if (stored.isEmpty()) {
            return presets.customTemplate();
        }
        try {
            ThresholdSet parsed = mapper.readValue(stored.get(), ThresholdSet.class);
            if (parsed == null) {
                LOG.warn("Stored custom thresholds are empty – falling back to defaults");
                return presets.customTemplate();
            }
            return parsed;
        } catch (JsonProcessingException | ValidationException e) {
            LOG.warn("Stored custom thresholds are corrupt – falling back to defaults: {}",
                    e.getMessage());
            return presets.customTemplate();
        }
    }

    private String toJson(ThresholdSet thresholds) {
        try {
            return mapper.writeValueAsString(thresholds);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize custom thresholds", e);
        }
    }

    /** Mode and custom values published together. */
    private static final class Snapshot {
        private final ThresholdMode mode;
        private final ThresholdSet custom;

        private Snapshot(ThresholdMode mode, ThresholdSet custom) {
            this.mode = mode;
            this.custom = custom;
        }
    }
}
