package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.model.DetectorKind;
import com.sensorsentinel.core.stats.RobustStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Global Z-score detector.
 *
 * <p>
 * Scores each value by its signed distance from the snapshot mean in units of
 * the population standard deviation. A value is flagged when the absolute
 * score exceeds the threshold.
 * </p>
 *
 * <p>
 * A flat snapshot has no spread; the standard deviation is then replaced by
 * {@value #STD_DEV_FLOOR} so every score stays finite.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    /** Minimum snapshot length for which scores are produced. */
    static final int MIN_POINTS = 2;

    static final double STD_DEV_FLOOR = 0.1;

    /** Standard deviations below this are treated as zero. */
    static final double ZERO_TOLERANCE = 1e-12;

    @Override
    public DetectorResult evaluate(double[] values, double threshold) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        if (n < MIN_POINTS) {
            return DetectorResult.empty();
        }

        double mean = RobustStatistics.mean(values);
        double stdDev = RobustStatistics.populationStdDev(values, mean);
        if (stdDev < ZERO_TOLERANCE) {
            stdDev = STD_DEV_FLOOR;
        }

        double[] scores = new double[n];
        boolean[] flags = new boolean[n];
        for (int i = 0; i < n; i++) {
            scores[i] = (values[i] - mean) / stdDev;
            flags[i] = Math.abs(scores[i]) > threshold;
        }

        LOG.trace("Z-score: mean={} stddev={} over {} point(s)", mean, stdDev, n);
        return new DetectorResult(scores, flags);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.Z_SCORE;
    }
}
