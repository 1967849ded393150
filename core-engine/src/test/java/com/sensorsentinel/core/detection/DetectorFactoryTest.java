package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.config.DetectionConfig;
import com.sensorsentinel.core.model.DetectorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create the matching detector for every kind")
    void shouldCreateEachKind() {
        DetectionConfig config = DetectionConfig.defaults();

        assertThat(DetectorFactory.create(DetectorKind.Z_SCORE, config)).isInstanceOf(ZScoreDetector.class);
        assertThat(DetectorFactory.create(DetectorKind.MAD, config)).isInstanceOf(MadDetector.class);
        assertThat(DetectorFactory.create(DetectorKind.EWMA, config)).isInstanceOf(EwmaDetector.class);
        assertThat(DetectorFactory.create(DetectorKind.HAMPEL, config)).isInstanceOf(HampelDetector.class);
        assertThat(DetectorFactory.create(DetectorKind.RATE, config)).isInstanceOf(RateOfChangeDetector.class);
    }

    @Test
    @DisplayName("Should pass configured parameters to the detectors")
    void shouldApplyParameters() {
        DetectionConfig config = new DetectionConfig();
        config.setEwmaAlpha(0.3);
        config.setEwmaLambda(0.8);
        config.setHampelWindow(5);

        EwmaDetector ewma = (EwmaDetector) DetectorFactory.create(DetectorKind.EWMA, config);
        HampelDetector hampel = (HampelDetector) DetectorFactory.create(DetectorKind.HAMPEL, config);

        assertThat(ewma.getAlpha()).isEqualTo(0.3);
        assertThat(ewma.getLambda()).isEqualTo(0.8);
        assertThat(hampel.getWindow()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should create one detector per kind in declaration order")
    void shouldCreateAll() {
        List<AnomalyDetector> detectors = DetectorFactory.createAll(DetectionConfig.defaults());

        assertThat(detectors).extracting(AnomalyDetector::getKind)
                .containsExactly(DetectorKind.values());
    }

    @Test
    @DisplayName("Should reject out-of-range parameters")
    void shouldRejectInvalidParameters() {
        DetectionConfig config = new DetectionConfig();
        config.setHampelWindow(0);

        assertThatThrownBy(() -> DetectorFactory.create(DetectorKind.HAMPEL, config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("window");
    }
}
