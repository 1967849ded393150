/**
 * Engine configuration and threshold selection.
 *
 * <p>
 * Detector parameters and threshold presets are defined in YAML and loaded by
 * {@link com.sensorsentinel.core.config.DetectionConfigLoader} into a
 * {@link com.sensorsentinel.core.config.DetectionConfig}. The operator's mode
 * choice and custom thresholds live in a
 * {@link com.sensorsentinel.core.config.ThresholdConfigurationStore}, persisted
 * through a {@link com.sensorsentinel.core.config.KeyValueStore}.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorsentinel.core.config;
