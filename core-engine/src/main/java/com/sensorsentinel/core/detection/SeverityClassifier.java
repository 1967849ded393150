package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.model.Severity;

/**
 * Grades a scored point by detector agreement and Z-score overshoot.
 *
 * <ul>
 * <li>{@link Severity#CRITICAL}: at least {@value #CRITICAL_DETECTORS}
 * detectors fired, or {@code |z| > 2 × zThreshold}</li>
 * <li>{@link Severity#HIGH}: at least {@value #HIGH_DETECTORS} detectors fired,
 * or {@code |z| > 1.5 × zThreshold}</li>
 * <li>{@link Severity#MEDIUM}: any other anomalous point</li>
 * <li>{@link Severity#NONE}: no detector fired</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SeverityClassifier {

    static final int CRITICAL_DETECTORS = 4;
    static final int HIGH_DETECTORS = 3;
    static final double CRITICAL_Z_FACTOR = 2.0;
    static final double HIGH_Z_FACTOR = 1.5;

    private SeverityClassifier() {
    }

    /**
     * @param firedDetectors number of detectors that flagged the point
     * @param zScore         the point's Z-score
     * @param zThreshold     Z-score threshold in effect
     * @return the severity grade
     */
    public static Severity classify(int firedDetectors, double zScore, double zThreshold) {
        if (firedDetectors <= 0) {
            return Severity.NONE;
        }
        double magnitude = Math.abs(zScore);
        if (firedDetectors >= CRITICAL_DETECTORS || magnitude > zThreshold * CRITICAL_Z_FACTOR) {
            return Severity.CRITICAL;
        }
        if (firedDetectors >= HIGH_DETECTORS || magnitude > zThreshold * HIGH_Z_FACTOR) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }
}
