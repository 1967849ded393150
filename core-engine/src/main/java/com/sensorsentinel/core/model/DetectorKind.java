package com.sensorsentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of detectors run by the pipeline.
 *
 * <p>
 * The {@link #key()} is the name used in threshold sets, persisted custom
 * thresholds and configuration files; the {@link #label()} is meant for
 * display.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorKind {

    Z_SCORE("zScore", "Z-Score"),
    MAD("mad", "MAD"),
    EWMA("ewma", "EWMA"),
    HAMPEL("hampel", "Hampel"),
    RATE("rate", "Rate-of-Change");

    private final String key;
    private final String label;

    DetectorKind(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    /**
     * Look up a detector by its key, ignoring case.
     *
     * @param key detector key such as {@code zScore} or {@code rate}
     * @return the matching detector, or empty if none matches
     */
    public static Optional<DetectorKind> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalised = key.trim().toLowerCase(Locale.ROOT);
        for (DetectorKind kind : values()) {
            if (kind.key.toLowerCase(Locale.ROOT).equals(normalised)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
