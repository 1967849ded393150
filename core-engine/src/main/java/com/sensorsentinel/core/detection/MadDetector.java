package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.model.DetectorKind;
import com.sensorsentinel.core.stats.RobustStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Median-absolute-deviation detector.
 *
 * <p>
 * Scores each value as {@code |v - median| / MAD} over the whole snapshot.
 * Robust against the outliers it is looking for, unlike the Z-score.
 * </p>
 *
 * @since 1.0.0
 */
public class MadDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MadDetector.class);

    static final int MIN_POINTS = 2;

    /** Replaces a zero deviation. */
    static final double DEVIATION_FLOOR = 1e-6;

    @Override
    public DetectorResult evaluate(double[] values, double threshold) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        if (n < MIN_POINTS) {
            return DetectorResult.empty();
        }

        double median = RobustStatistics.median(values);
        double deviation = RobustStatistics.robustDeviation(values, median);
        if (deviation == 0) {
            deviation = DEVIATION_FLOOR;
        }

        double[] scores = new double[n];
        boolean[] flags = new boolean[n];
        for (int i = 0; i < n; i++) {
            scores[i] = Math.abs(values[i] - median) / deviation;
            flags[i] = scores[i] > threshold;
        }

        LOG.trace("MAD: median={} deviation={} over {} point(s)", median, deviation, n);
        return new DetectorResult(scores, flags);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.MAD;
    }
}
