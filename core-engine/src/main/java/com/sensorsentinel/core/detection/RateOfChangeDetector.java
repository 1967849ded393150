package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.model.DetectorKind;

import java.util.Objects;

/**
 * Rate-of-change detector.
 *
 * <p>
 * Scores each value by its absolute difference from the previous reading.
 * The first reading has no predecessor: it scores {@code 0} and is never
 * flagged. This is a <strong>stateless</strong> detector.
 * </p>
 *
 * @since 1.0.0
 */
public class RateOfChangeDetector implements AnomalyDetector {

    @Override
    public DetectorResult evaluate(double[] values, double threshold) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        double[] scores = new double[n];
        boolean[] flags = new boolean[n];
        for (int i = 1; i < n; i++) {
            scores[i] = Math.abs(values[i] - values[i - 1]);
            flags[i] = scores[i] > threshold;
        }
        return new DetectorResult(scores, flags);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.RATE;
    }
}
