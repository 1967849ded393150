package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.model.DetectorKind;
import com.sensorsentinel.core.stats.RobustStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Hampel rolling-window filter.
 *
 * <p>
 * For each index {@code i} the local window is
 * {@code [max(0, i - floor(w/2)), min(n, i + ceil(w/2)))}. Windows near the
 * ends of the snapshot are shorter; they are never padded or wrapped. The
 * score is the distance from the window median in units of the window MAD,
 * rescaled by {@value #MAD_SCALE} to be comparable to a normal standard
 * deviation.
 * </p>
 *
 * <p>
 * Snapshots shorter than the window produce no scores.
 * </p>
 *
 * @since 1.0.0
 */
public class HampelDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(HampelDetector.class);

    public static final int DEFAULT_WINDOW = 7;

    /** Consistency constant between MAD and standard deviation for normal data. */
    static final double MAD_SCALE = 1.4826;

    static final double DEVIATION_FLOOR = 1e-6;

    private final int window;

    public HampelDetector() {
        this(DEFAULT_WINDOW);
    }

    /**
     * @param window window length in points; must be &gt;= 1
     * @throws IllegalArgumentException if {@code window} is less than 1
     */
    public HampelDetector(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, got: " + window);
        }
        this.window = window;
    }

    @Override
    public DetectorResult evaluate(double[] values, double threshold) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        if (n < window) {
            LOG.trace("Hampel: {} point(s) is shorter than window {} – skipping", n, window);
            return DetectorResult.empty();
        }

        int before = window / 2;
        int after = (window + 1) / 2;

        double[] scores = new double[n];
        boolean[] flags = new boolean[n];
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - before);
            int to = Math.min(n, i + after);
            double median = RobustStatistics.median(values, from, to);
            double deviation = RobustStatistics.robustDeviation(values, from, to, median);
            if (deviation == 0) {
                deviation = DEVIATION_FLOOR;
            }
            scores[i] = Math.abs(values[i] - median) / (MAD_SCALE * deviation);
            flags[i] = scores[i] > threshold;
        }
        return new DetectorResult(scores, flags);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.HAMPEL;
    }

    public int getWindow() {
        return window;
    }
}
