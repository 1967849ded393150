package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.model.DetectorKind;
import com.sensorsentinel.core.stats.RobustStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Exponentially weighted moving average detector.
 *
 * <p>
 * Walks the snapshot in order, keeping a smoothed mean and a smoothed
 * standard deviation. Each point after the first updates both estimates and
 * is scored by its distance from the updated mean in units of the updated
 * deviation:
 * </p>
 *
 * <pre>
 *   ewma   = alpha * v + (1 - alpha) * ewma
 *   diff   = v - ewma
 *   ewmstd = sqrt(lambda * ewmstd^2 + (1 - lambda) * diff^2)
 *   score  = |v - ewma| / max(ewmstd, 0.1)
 * </pre>
 *
 * <h3>Seeding</h3>
 * <p>
 * Both estimates start from the mean and population standard deviation of
 * the whole snapshot rather than from the first reading, which keeps early
 * scores stable. The first point always scores {@code 0} and is never
 * flagged.
 * </p>
 *
 * <p>
 * The recursion is strictly sequential; points cannot be scored in parallel.
 * </p>
 *
 * @since 1.0.0
 */
public class EwmaDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(EwmaDetector.class);

    public static final double DEFAULT_ALPHA = 0.1;
    public static final double DEFAULT_LAMBDA = 0.94;

    static final int MIN_POINTS = 2;
    static final double STD_DEV_FLOOR = 0.1;

    private final double alpha;
    private final double lambda;

    public EwmaDetector() {
        this(DEFAULT_ALPHA, DEFAULT_LAMBDA);
    }

    /**
     * @param alpha  weight of the newest value in the mean, in {@code (0, 1]}
     * @param lambda weight of the previous variance, in {@code (0, 1]}
     * @throws IllegalArgumentException if either factor is out of range
     */
    public EwmaDetector(double alpha, double lambda) {
        if (!(alpha > 0 && alpha <= 1)) {
            throw new IllegalArgumentException("alpha must be in (0, 1], got: " + alpha);
        }
        if (!(lambda > 0 && lambda <= 1)) {
            throw new IllegalArgumentException("lambda must be in (0, 1], got: " + lambda);
        }
        this.alpha = alpha;
        this.lambda = lambda;
    }

    @Override
    public DetectorResult evaluate(double[] values, double threshold) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        if (n < MIN_POINTS) {
            return DetectorResult.empty();
        }

        double ewma = RobustStatistics.mean(values);
        double ewmstd = RobustStatistics.populationStdDev(values, ewma);

        double[] scores = new double[n];
        boolean[] flags = new boolean[n];
        // index 0 stays at score 0, not flagged
        for (int i = 1; i < n; i++) {
            double v = values[i];
            ewma = alpha * v + (1 - alpha) * ewma;
            double diff = v - ewma;
            ewmstd = Math.sqrt(lambda * ewmstd * ewmstd + (1 - lambda) * diff * diff);
            scores[i] = Math.abs(diff) / Math.max(ewmstd, STD_DEV_FLOOR);
            flags[i] = scores[i] > threshold;
        }

        LOG.trace("EWMA: final ewma={} ewmstd={} over {} point(s)", ewma, ewmstd, n);
        return new DetectorResult(scores, flags);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.EWMA;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getLambda() {
        return lambda;
    }
}
