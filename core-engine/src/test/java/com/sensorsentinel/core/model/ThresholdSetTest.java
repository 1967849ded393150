package com.sensorsentinel.core.model;

import com.sensorsentinel.core.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ThresholdSet}.
 */
class ThresholdSetTest {

    @Test
    @DisplayName("Presets should carry the documented cutoffs")
    void presetValues() {
        assertThat(ThresholdSet.RESTRICTED.asKeyedMap())
                .containsExactly(Map.entry("zScore", 3.5), Map.entry("mad", 3.5), Map.entry("ewma", 2.5),
                        Map.entry("hampel", 3.5), Map.entry("rate", 25.0));
        assertThat(ThresholdSet.NORMAL.asKeyedMap())
                .containsExactly(Map.entry("zScore", 2.7), Map.entry("mad", 2.7), Map.entry("ewma", 2.0),
                        Map.entry("hampel", 2.7), Map.entry("rate", 15.0));
        assertThat(ThresholdSet.RELAXED.asKeyedMap())
                .containsExactly(Map.entry("zScore", 2.0), Map.entry("mad", 2.0), Map.entry("ewma", 1.5),
                        Map.entry("hampel", 2.0), Map.entry("rate", 10.0));
        assertThat(ThresholdSet.DEFAULT).isEqualTo(ThresholdSet.NORMAL);
    }

    @Test
    @DisplayName("with() should replace exactly one cutoff")
    void withReplacesOneValue() {
        ThresholdSet updated = ThresholdSet.NORMAL.with(DetectorKind.RATE, 40);

        assertThat(updated.get(DetectorKind.RATE)).isEqualTo(40);
        assertThat(updated.get(DetectorKind.Z_SCORE)).isEqualTo(2.7);
        assertThat(ThresholdSet.NORMAL.getRate()).isEqualTo(15);
    }

    @Test
    @DisplayName("Should reject zero, negative and non-finite cutoffs")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> ThresholdSet.NORMAL.with(DetectorKind.MAD, 0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("mad");
        assertThatThrownBy(() -> ThresholdSet.NORMAL.with(DetectorKind.EWMA, -1))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ThresholdSet.NORMAL.with(DetectorKind.HAMPEL, Double.NaN))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("fromMap should overlay known keys and reject unknown ones")
    void fromMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("zScore", 3);
        values.put("ewma", 1.2);

        ThresholdSet set = ThresholdSet.fromMap(values, ThresholdSet.RELAXED);

        assertThat(set.getZScore()).isEqualTo(3.0);
        assertThat(set.getEwma()).isEqualTo(1.2);
        assertThat(set.getRate()).isEqualTo(10.0);

        assertThatThrownBy(() -> ThresholdSet.fromMap(Map.of("volume", 1), ThresholdSet.NORMAL))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("volume");
        assertThatThrownBy(() -> ThresholdSet.fromMap(Map.of("rate", "fast"), ThresholdSet.NORMAL))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("number");
    }
}
