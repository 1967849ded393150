package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.ValidationException;
import com.sensorsentinel.core.config.DetectionConfig;
import com.sensorsentinel.core.config.ThresholdConfigurationStore;
import com.sensorsentinel.core.model.DetectionSummary;
import com.sensorsentinel.core.model.DetectorKind;
import com.sensorsentinel.core.model.ScoredPoint;
import com.sensorsentinel.core.model.SeriesPoint;
import com.sensorsentinel.core.model.ThresholdSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs every detector over one snapshot and merges the results.
 *
 * <h3>Run</h3>
 * <ol>
 * <li>Validate the snapshot: no {@code null} points, finite values,
 * non-decreasing timestamps.</li>
 * <li>Evaluate each detector against the same values and the same
 * {@link ThresholdSet}.</li>
 * <li>Merge the per-detector scores and flags into one {@link ScoredPoint}
 * per input point and grade its severity.</li>
 * <li>Aggregate counts and the anomaly subset into a
 * {@link DetectionSummary}.</li>
 * </ol>
 *
 * <p>
 * A run is a pure function of the snapshot, the thresholds and the detector
 * parameters; nothing carries over between runs. A detector that returns no
 * scores for a short snapshot contributes score {@code 0}, not flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionPipeline.class);

    private final List<AnomalyDetector> detectors;

    /**
     * Pipeline with the built-in detector parameters.
     */
    public DetectionPipeline() {
        this(DetectionConfig.defaults());
    }

    public DetectionPipeline(DetectionConfig config) {
        this(DetectorFactory.createAll(config));
    }

    /**
     * @param detectors exactly one detector per {@link DetectorKind}
     * @throws IllegalArgumentException if a kind is missing or duplicated
     */
    public DetectionPipeline(List<AnomalyDetector> detectors) {
        Objects.requireNonNull(detectors, "detectors must not be null");
        Map<DetectorKind, AnomalyDetector> byKind = new EnumMap<>(DetectorKind.class);
        for (AnomalyDetector detector : detectors) {
            Objects.requireNonNull(detector, "detector must not be null");
            if (byKind.put(detector.getKind(), detector) != null) {
                throw new IllegalArgumentException("Duplicate detector for " + detector.getKind());
            }
        }
        if (byKind.size() != DetectorKind.values().length) {
            throw new IllegalArgumentException(
                    "Expected one detector per kind, got: " + byKind.keySet());
        }
        this.detectors = List.copyOf(byKind.values());
    }

    /**
     * Run with the store's active thresholds, read once as a consistent
     * snapshot.
     *
     * @see #run(List, ThresholdSet)
     */
    public DetectionSummary run(List<SeriesPoint> snapshot, ThresholdConfigurationStore store) {
        Objects.requireNonNull(store, "store must not be null");
        return run(snapshot, store.activeThresholds());
    }

    /**
     * Score a snapshot.
     *
     * @param snapshot   readings in ascending timestamp order
     * @param thresholds cutoffs for every detector
     * @return scored points, counts and anomaly subset
     * @throws ValidationException if the snapshot contains a {@code null} point,
     *                             a non-finite value, or a timestamp earlier than
     *                             its predecessor
     */
    public DetectionSummary run(List<SeriesPoint> snapshot, ThresholdSet thresholds) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(thresholds, "thresholds must not be null");

        double[] values = validatedValues(snapshot);

        Map<DetectorKind, DetectorResult> results = new EnumMap<>(DetectorKind.class);
        for (AnomalyDetector detector : detectors) {
            DetectorKind kind = detector.getKind();
            DetectorResult result = detector.evaluate(values, thresholds.get(kind));
            if (!result.isEmpty() && result.size() != values.length) {
                throw new IllegalStateException("Detector " + kind + " returned " + result.size()
                        + " score(s) for " + values.length + " point(s)");
            }
            results.put(kind, result);
        }

        List<ScoredPoint> scored = new ArrayList<>(snapshot.size());
        for (int i = 0; i < snapshot.size(); i++) {
            ScoredPoint.Builder builder = ScoredPoint.builder(snapshot.get(i));
            for (Map.Entry<DetectorKind, DetectorResult> entry : results.entrySet()) {
                DetectorResult result = entry.getValue();
                if (!result.isEmpty()) {
                    builder.score(entry.getKey(), result.score(i), result.isAnomaly(i));
                }
            }
            builder.severity(SeverityClassifier.classify(builder.firedCount(),
                    builder.scoreOf(DetectorKind.Z_SCORE), thresholds.getZScore()));
            scored.add(builder.build());
        }

        DetectionSummary summary = new DetectionSummary(scored, thresholds);
        LOG.debug("Scored {} point(s): {} anomalous, counts={}",
                summary.getTotalPoints(), summary.getTotalAnomalies(), summary.getCounts());
        return summary;
    }

    private static double[] validatedValues(List<SeriesPoint> snapshot) {
        double[] values = new double[snapshot.size()];
        Instant previous = null;
        for (int i = 0; i < values.length; i++) {
            SeriesPoint point = snapshot.get(i);
            if (point == null) {
                throw new ValidationException("Snapshot point at index " + i + " is null");
            }
            if (!Double.isFinite(point.getValue())) {
                throw new ValidationException("Snapshot point at index " + i
                        + " has a non-finite value: " + point.getValue());
            }
            if (previous != null && point.getTimestamp().isBefore(previous)) {
                throw new ValidationException("Snapshot is not in chronological order: index " + i
                        + " (" + point.getTimestamp() + ") precedes " + previous);
            }
            previous = point.getTimestamp();
            values[i] = point.getValue();
        }
        return values;
    }
}
