package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.config.DetectionConfig;
import com.sensorsentinel.core.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from a
 * {@link DetectionConfig}.
 *
 * <p>
 * This is the single point of extension when adding a detector: add the
 * {@link DetectorKind} constant and create the corresponding detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class — not instantiable
    }

    /**
     * Create the detector for one kind.
     *
     * @param kind   which detector; must not be {@code null}
     * @param config detector parameters; must not be {@code null}
     * @return a configured detector
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public static AnomalyDetector create(DetectorKind kind, DetectionConfig config) {
        Objects.requireNonNull(kind, "DetectorKind must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        return switch (kind) {
            case Z_SCORE -> new ZScoreDetector();
            case MAD -> new MadDetector();
            case EWMA -> new EwmaDetector(config.getEwmaAlpha(), config.getEwmaLambda());
            case HAMPEL -> new HampelDetector(config.getHampelWindow());
            case RATE -> new RateOfChangeDetector();
        };
    }

    /**
     * Create one detector per {@link DetectorKind}, in declaration order.
     *
     * @param config detector parameters; must not be {@code null}
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        List<AnomalyDetector> detectors = new ArrayList<>();
        for (DetectorKind kind : DetectorKind.values()) {
            detectors.add(create(kind, config));
        }
        LOG.info("Created {} detector(s): ewmaAlpha={} ewmaLambda={} hampelWindow={}",
                detectors.size(), config.getEwmaAlpha(), config.getEwmaLambda(), config.getHampelWindow());
        return Collections.unmodifiableList(detectors);
    }
}
