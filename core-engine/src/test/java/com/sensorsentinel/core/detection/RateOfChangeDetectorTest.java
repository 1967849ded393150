package com.sensorsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RateOfChangeDetector}.
 */
class RateOfChangeDetectorTest {

    private final RateOfChangeDetector detector = new RateOfChangeDetector();

    @Test
    @DisplayName("Should flag a jump larger than the threshold")
    void shouldFlagJump() {
        DetectorResult result = detector.evaluate(new double[] { 50, 55, 53, 90, 91 }, 20);

        assertThat(result.scores()).containsExactly(0, 5, 2, 37, 1);
        assertThat(result.isAnomaly(3)).isTrue();
        assertThat(result.anomalyCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not flag a jump equal to the threshold")
    void thresholdIsExclusive() {
        DetectorResult result = detector.evaluate(new double[] { 0, 20 }, 20);

        assertThat(result.isAnomaly(1)).isFalse();
    }

    @Test
    @DisplayName("Should score a single point as 0")
    void shouldHandleSinglePoint() {
        DetectorResult result = detector.evaluate(new double[] { 7 }, 1);

        assertThat(result.size()).isEqualTo(1);
        assertThat(result.score(0)).isZero();
        assertThat(result.isAnomaly(0)).isFalse();
    }
}
