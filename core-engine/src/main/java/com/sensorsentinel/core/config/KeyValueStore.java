package com.sensorsentinel.core.config;

import java.util.Optional;

/**
 * Opaque string key–value persistence used by the
 * {@link ThresholdConfigurationStore} to remember the selected mode and the
 * custom thresholds between sessions.
 */
public interface KeyValueStore {

    /**
     * @param key entry name
     * @return the stored value, or empty if nothing is stored under {@code key}
     */
    Optional<String> getString(String key);

    /**
     * Store {@code value} under {@code key}, replacing any previous value.
     *
     * @param key   entry name
     * @param value value to store; must not be {@code null}
     */
    void setString(String key, String value);
}
