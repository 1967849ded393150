package com.sensorsentinel.core.detection;

import java.util.Objects;

/**
 * Per-point scores and flags produced by one {@link AnomalyDetector}.
 *
 * <p>
 * Either empty (the snapshot was too short for the detector) or exactly as
 * long as the snapshot.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorResult {

    private static final DetectorResult EMPTY = new DetectorResult(new double[0], new boolean[0]);

    private final double[] scores;
    private final boolean[] flags;

    /**
     * @param scores per-point scores
     * @param flags  per-point anomaly flags; same length as {@code scores}
     */
    public DetectorResult(double[] scores, boolean[] flags) {
        Objects.requireNonNull(scores, "scores must not be null");
        Objects.requireNonNull(flags, "flags must not be null");
        if (scores.length != flags.length) {
            throw new IllegalArgumentException(
                    "scores and flags differ in length: " + scores.length + " vs " + flags.length);
        }
        this.scores = scores.clone();
        this.flags = flags.clone();
    }

    public static DetectorResult empty() {
        return EMPTY;
    }

    public int size() {
        return scores.length;
    }

    public boolean isEmpty() {
        return scores.length == 0;
    }

    public double score(int index) {
        return scores[index];
    }

    public boolean isAnomaly(int index) {
        return flags[index];
    }

    public int anomalyCount() {
        int count = 0;
        for (boolean flag : flags) {
            if (flag) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return a copy of the scores
     */
    public double[] scores() {
        return scores.clone();
    }
}
