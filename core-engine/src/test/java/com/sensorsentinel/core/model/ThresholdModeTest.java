package com.sensorsentinel.core.model;

import com.sensorsentinel.core.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ThresholdMode} and {@link DetectorKind} name lookup.
 */
class ThresholdModeTest {

    @ParameterizedTest
    @CsvSource({ "relaxed, RELAXED", "Normal, NORMAL", " RESTRICTED , RESTRICTED", "custom, CUSTOM" })
    @DisplayName("Should resolve mode names ignoring case and surrounding blanks")
    void shouldResolveModeNames(String name, ThresholdMode expected) {
        assertThat(ThresholdMode.fromName(name)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "   ", "strict", "normal-ish" })
    @DisplayName("Should reject blank or unknown mode names")
    void shouldRejectUnknownModes(String name) {
        assertThatThrownBy(() -> ThresholdMode.fromName(name))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Mode keys are the lowercase names used for persistence")
    void modeKeys() {
        assertThat(ThresholdMode.CUSTOM.key()).isEqualTo("custom");
    }

    @Test
    @DisplayName("Detector keys resolve ignoring case")
    void detectorKeys() {
        assertThat(DetectorKind.fromKey("zscore")).contains(DetectorKind.Z_SCORE);
        assertThat(DetectorKind.fromKey("RATE")).contains(DetectorKind.RATE);
        assertThat(DetectorKind.fromKey("volume")).isEmpty();
    }
}
