package com.sensorsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensorsentinel.core.ValidationException;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-detector sensitivity cutoffs.
 *
 * <p>
 * A point is flagged by a detector when its score exceeds the matching value
 * here. Every value is a finite number greater than zero. Instances are
 * immutable; use {@link #with(DetectorKind, double)} to derive a modified
 * copy.
 * </p>
 *
 * <p>
 * Serialized to JSON as
 * {@code {"zScore":2.7,"mad":2.7,"ewma":2.0,"hampel":2.7,"rate":15.0}}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdSet implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Higher cutoffs, fewer anomalies. */
    public static final ThresholdSet RESTRICTED = new ThresholdSet(3.5, 3.5, 2.5, 3.5, 25);

    /** Balanced cutoffs. */
    public static final ThresholdSet NORMAL = new ThresholdSet(2.7, 2.7, 2.0, 2.7, 15);

    /** Lower cutoffs, more anomalies. */
    public static final ThresholdSet RELAXED = new ThresholdSet(2.0, 2.0, 1.5, 2.0, 10);

    /** Template for the initial custom thresholds. */
    public static final ThresholdSet DEFAULT = new ThresholdSet(2.7, 2.7, 2.0, 2.7, 15);

    private final double zScore;
    private final double mad;
    private final double ewma;
    private final double hampel;
    private final double rate;

    /**
     * @throws ValidationException if any value is not a finite number &gt; 0
     */
    @JsonCreator
    public ThresholdSet(@JsonProperty("zScore") double zScore,
            @JsonProperty("mad") double mad,
            @JsonProperty("ewma") double ewma,
            @JsonProperty("hampel") double hampel,
            @JsonProperty("rate") double rate) {
        this.zScore = requirePositive(DetectorKind.Z_SCORE, zScore);
        this.mad = requirePositive(DetectorKind.MAD, mad);
        this.ewma = requirePositive(DetectorKind.EWMA, ewma);
        this.hampel = requirePositive(DetectorKind.HAMPEL, hampel);
        this.rate = requirePositive(DetectorKind.RATE, rate);
    }

    /**
     * Build a set from a key → value map such as one read from YAML.
     * Keys missing from {@code values} are taken from {@code fallback}.
     *
     * @param values   detector key to numeric threshold; unknown keys and
     *                 non-numeric values are rejected
     * @param fallback source of values not present in {@code values}
     * @return the combined threshold set
     * @throws ValidationException if a key is unknown or a value is invalid
     */
    public static ThresholdSet fromMap(Map<String, ?> values, ThresholdSet fallback) {
        Objects.requireNonNull(fallback, "fallback must not be null");
        ThresholdSet result = fallback;
        if (values == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            DetectorKind kind = DetectorKind.fromKey(entry.getKey())
                    .orElseThrow(() -> new ValidationException(
                            "Unknown detector key: '" + entry.getKey()
                                    + "'. Supported: zScore, mad, ewma, hampel, rate"));
            if (!(entry.getValue() instanceof Number number)) {
                throw new ValidationException("Threshold '" + kind.key()
                        + "' must be a number, got: " + entry.getValue());
            }
            result = result.with(kind, number.doubleValue());
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @param kind detector
     * @return the cutoff for {@code kind}
     */
    public double get(DetectorKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return switch (kind) {
            case Z_SCORE -> zScore;
            case MAD -> mad;
            case EWMA -> ewma;
            case HAMPEL -> hampel;
            case RATE -> rate;
        };
    }

    /**
     * Return a copy with one cutoff replaced.
     *
     * @throws ValidationException if {@code value} is not a finite number &gt; 0
     */
    public ThresholdSet with(DetectorKind kind, double value) {
        Objects.requireNonNull(kind, "kind must not be null");
        return new ThresholdSet(
                kind == DetectorKind.Z_SCORE ? value : zScore,
                kind == DetectorKind.MAD ? value : mad,
                kind == DetectorKind.EWMA ? value : ewma,
                kind == DetectorKind.HAMPEL ? value : hampel,
                kind == DetectorKind.RATE ? value : rate);
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    @JsonProperty("mad")
    public double getMad() {
        return mad;
    }

    @JsonProperty("ewma")
    public double getEwma() {
        return ewma;
    }

    @JsonProperty("hampel")
    public double getHampel() {
        return hampel;
    }

    @JsonProperty("rate")
    public double getRate() {
        return rate;
    }

    /**
     * @return cutoffs keyed by {@link DetectorKind#key()}, in detector order
     */
    @JsonIgnore
    public Map<String, Double> asKeyedMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (DetectorKind kind : DetectorKind.values()) {
            map.put(kind.key(), get(kind));
        }
        return map;
    }

    private static double requirePositive(DetectorKind kind, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new ValidationException(
                    "Threshold '" + kind.key() + "' must be a finite number > 0, got: " + value);
        }
        return value;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdSet that))
            return false;
        return Double.compare(zScore, that.zScore) == 0
                && Double.compare(mad, that.mad) == 0
                && Double.compare(ewma, that.ewma) == 0
                && Double.compare(hampel, that.hampel) == 0
                && Double.compare(rate, that.rate) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(zScore, mad, ewma, hampel, rate);
    }

    @Override
    public String toString() {
        return "ThresholdSet{" +
                "zScore=" + zScore +
                ", mad=" + mad +
                ", ewma=" + ewma +
                ", hampel=" + hampel +
                ", rate=" + rate +
                '}';
    }
}
