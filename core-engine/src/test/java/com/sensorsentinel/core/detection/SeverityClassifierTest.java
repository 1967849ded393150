package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeverityClassifier}.
 */
class SeverityClassifierTest {

    private static final double Z_THRESHOLD = 2.7;

    @Test
    @DisplayName("Points no detector flagged have no severity")
    void noneWhenNothingFired() {
        assertThat(SeverityClassifier.classify(0, 10.0, Z_THRESHOLD)).isEqualTo(Severity.NONE);
    }

    @Test
    @DisplayName("A single detector with a modest Z-score is MEDIUM")
    void mediumForSingleDetector() {
        assertThat(SeverityClassifier.classify(1, 1.0, Z_THRESHOLD)).isEqualTo(Severity.MEDIUM);
        assertThat(SeverityClassifier.classify(2, 2.0, Z_THRESHOLD)).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Three detectors or |z| above 1.5x threshold is HIGH")
    void highByAgreementOrOvershoot() {
        assertThat(SeverityClassifier.classify(3, 0.0, Z_THRESHOLD)).isEqualTo(Severity.HIGH);
        assertThat(SeverityClassifier.classify(1, 4.1, Z_THRESHOLD)).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Four detectors or |z| above 2x threshold is CRITICAL")
    void criticalByAgreementOrOvershoot() {
        assertThat(SeverityClassifier.classify(4, 0.0, Z_THRESHOLD)).isEqualTo(Severity.CRITICAL);
        assertThat(SeverityClassifier.classify(5, 0.0, Z_THRESHOLD)).isEqualTo(Severity.CRITICAL);
        assertThat(SeverityClassifier.classify(1, 5.5, Z_THRESHOLD)).isEqualTo(Severity.CRITICAL);
        assertThat(SeverityClassifier.classify(1, -5.5, Z_THRESHOLD)).isEqualTo(Severity.CRITICAL);
    }
}
