package com.sensorsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HampelDetector}.
 */
class HampelDetectorTest {

    @Test
    @DisplayName("Should flag a point far from its rolling median")
    void shouldFlagLocalOutlier() {
        HampelDetector detector = new HampelDetector(3);

        DetectorResult result = detector.evaluate(new double[] { 10, 10, 10, 10, 10, 100, 10, 10 }, 2.7);

        assertThat(result.size()).isEqualTo(8);
        assertThat(result.isAnomaly(5)).isTrue();
        assertThat(result.anomalyCount()).isEqualTo(1);
        assertThat(result.score(4)).isZero();
        assertThat(result.score(6)).isZero();
    }

    @Test
    @DisplayName("Should scale the rolling MAD by 1.4826")
    void shouldScaleDeviation() {
        // window [2, 4, 6] around index 1: median 4, MAD 2
        HampelDetector detector = new HampelDetector(3);

        DetectorResult result = detector.evaluate(new double[] { 2, 4, 6 }, 2.7);

        assertThat(result.score(1)).isZero();
        // index 0 window [2, 4]: median 3, MAD 1
        assertThat(result.score(0)).isEqualTo(1.0 / 1.4826);
    }

    @Test
    @DisplayName("Should return no scores when the series is shorter than the window")
    void shouldSkipShortSeries() {
        assertThat(new HampelDetector().evaluate(new double[] { 1, 2, 3, 4, 5, 6 }, 2.7).isEmpty()).isTrue();
        assertThat(new HampelDetector().evaluate(new double[] { 1, 2, 3, 4, 5, 6, 7 }, 2.7).size()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should reject a window smaller than one")
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> new HampelDetector(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
