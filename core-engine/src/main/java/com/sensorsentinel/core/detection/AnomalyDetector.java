package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.model.DetectorKind;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong> between calls: every call to
 * {@link #evaluate(double[], double)} recomputes its estimates from the whole
 * snapshot, so one instance can score any number of snapshots and be shared
 * between threads.
 * </p>
 * <p>
 * The values must be in ascending timestamp order; windowed and recursive
 * detectors depend on it.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Score every value of a snapshot.
     *
     * @param values    readings in timestamp order; never modified
     * @param threshold cutoff above which a score is flagged
     * @return one score and flag per value, or {@link DetectorResult#empty()}
     *         when the snapshot is too short for this detector
     */
    DetectorResult evaluate(double[] values, double threshold);

    /**
     * @return which detector this is
     */
    DetectorKind getKind();
}
