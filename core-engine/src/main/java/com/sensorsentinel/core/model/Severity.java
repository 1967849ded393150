package com.sensorsentinel.core.model;

/**
 * Coarse grade of a scored point, driven by how many detectors agree and how
 * far the Z-score overshoots its threshold.
 *
 * @since 1.0.0
 */
public enum Severity {
    /** No detector fired. */
    NONE,
    MEDIUM,
    HIGH,
    CRITICAL
}
