package com.sensorsentinel.core.stats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Central-tendency and dispersion estimators shared by the detectors.
 *
 * <p>
 * Every method treats an empty input as a degenerate but legal case and
 * returns {@code 0} instead of failing. Inputs are never modified.
 * </p>
 *
 * @since 1.0.0
 */
public final class RobustStatistics {

    private RobustStatistics() {
        // utility class — not instantiable
    }

    /**
     * Median of {@code values}: the middle element for odd lengths, the mean of
     * the two middle elements for even lengths.
     *
     * @param values input values; must not be {@code null}
     * @return the median, or {@code 0} for an empty array
     */
    public static double median(double[] values) {
        return median(values, 0, Objects.requireNonNull(values, "values must not be null").length);
    }

    /**
     * Median of the half-open range {@code [from, to)} of {@code values}.
     *
     * @return the median of the range, or {@code 0} when the range is empty
     */
    public static double median(double[] values, int from, int to) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.checkFromToIndex(from, to, values.length);
        int n = to - from;
        if (n == 0) {
            return 0;
        }
        double[] sorted = Arrays.copyOfRange(values, from, to);
        Arrays.sort(sorted);
        int mid = n / 2;
        return n % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Median absolute deviation around the median of {@code values}.
     *
     * @return the deviation, or {@code 0} for an empty array
     */
    public static double robustDeviation(double[] values) {
        return robustDeviation(values, median(values));
    }

    /**
     * Median absolute deviation of {@code values} around {@code center}.
     *
     * @return {@code median(|v - center|)}, or {@code 0} for an empty array
     */
    public static double robustDeviation(double[] values, double center) {
        Objects.requireNonNull(values, "values must not be null");
        return robustDeviation(values, 0, values.length, center);
    }

    /**
     * Median absolute deviation of the range {@code [from, to)} around
     * {@code center}.
     */
    public static double robustDeviation(double[] values, int from, int to, double center) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.checkFromToIndex(from, to, values.length);
        double[] deviations = new double[to - from];
        for (int i = from; i < to; i++) {
            deviations[i - from] = Math.abs(values[i] - center);
        }
        return median(deviations);
    }

    /**
     * @return arithmetic mean, or {@code 0} for an empty array
     */
    public static double mean(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation (divides by {@code n}).
     *
     * @param values input values
     * @param mean   precomputed mean of {@code values}
     * @return the standard deviation, or {@code 0} for an empty array
     */
    public static double populationStdDev(double[] values, double mean) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            return 0;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }
}
