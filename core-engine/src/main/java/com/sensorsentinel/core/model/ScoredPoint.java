package com.sensorsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A {@link SeriesPoint} enriched with the score and flag of every detector.
 *
 * <p>
 * Produced only by the detection pipeline and never mutated afterwards. The
 * JSON form exposes the original {@code timestamp} and {@code value} plus
 * exactly these ten detector fields, which downstream consumers depend on by
 * name:
 * </p>
 * <ul>
 * <li>{@code scoreZScore}, {@code scoreMad}, {@code scoreEwma},
 * {@code scoreHampel}, {@code scoreRate}</li>
 * <li>{@code isZScoreAnomaly}, {@code isMadAnomaly}, {@code isEwmaAnomaly},
 * {@code isHampelAnomaly}, {@code isRateAnomaly}</li>
 * </ul>
 * <p>
 * A {@code severity} field is appended.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #builder(SeriesPoint)}. Detectors that were not recorded keep a
 * score of {@code 0} and are not flagged.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "timestamp", "value",
        "scoreZScore", "scoreMad", "scoreEwma", "scoreHampel", "scoreRate",
        "isZScoreAnomaly", "isMadAnomaly", "isEwmaAnomaly", "isHampelAnomaly", "isRateAnomaly",
        "severity" })
public final class ScoredPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;

    /** Indexed by {@link DetectorKind#ordinal()}. */
    private final double[] scores;
    private final boolean[] flags;

    private final Severity severity;

    private ScoredPoint(Builder builder) {
        this.timestamp = builder.point.getTimestamp();
        this.value = builder.point.getValue();
        this.scores = builder.scores.clone();
        this.flags = builder.flags.clone();
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * @param point the raw reading to enrich; must not be {@code null}
     * @return builder seeded with the reading
     */
    public static Builder builder(SeriesPoint point) {
        return new Builder(point);
    }

    /**
     * Fluent builder for {@link ScoredPoint} instances.
     */
    public static class Builder {
        private final SeriesPoint point;
        private final double[] scores = new double[DetectorKind.values().length];
        private final boolean[] flags = new boolean[DetectorKind.values().length];
        private Severity severity = Severity.NONE;

        private Builder(SeriesPoint point) {
            this.point = Objects.requireNonNull(point, "point must not be null");
        }

        public Builder score(DetectorKind kind, double score, boolean anomaly) {
            Objects.requireNonNull(kind, "kind must not be null");
            scores[kind.ordinal()] = score;
            flags[kind.ordinal()] = anomaly;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        /**
         * @return number of detectors flagged so far
         */
        public int firedCount() {
            int count = 0;
            for (boolean flag : flags) {
                if (flag) {
                    count++;
                }
            }
            return count;
        }

        public double scoreOf(DetectorKind kind) {
            return scores[kind.ordinal()];
        }

        public ScoredPoint build() {
            return new ScoredPoint(this);
        }
    }

    // ---------------------------------------------------------------
    // Generic accessors
    // ---------------------------------------------------------------

    public double score(DetectorKind kind) {
        return scores[kind.ordinal()];
    }

    public boolean isAnomaly(DetectorKind kind) {
        return flags[kind.ordinal()];
    }

    /**
     * @return {@code true} if at least one detector flagged this point
     */
    @JsonIgnore
    public boolean isAnomaly() {
        for (boolean flag : flags) {
            if (flag) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return unmodifiable set of detectors that flagged this point, in
     *         detector order
     */
    public Set<DetectorKind> triggeredDetectors() {
        EnumSet<DetectorKind> fired = EnumSet.noneOf(DetectorKind.class);
        for (DetectorKind kind : DetectorKind.values()) {
            if (flags[kind.ordinal()]) {
                fired.add(kind);
            }
        }
        return Collections.unmodifiableSet(fired);
    }

    // ---------------------------------------------------------------
    // Named accessors (JSON compatibility surface)
    // ---------------------------------------------------------------

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("value")
    public double getValue() {
        return value;
    }

    @JsonProperty("scoreZScore")
    public double getScoreZScore() {
        return score(DetectorKind.Z_SCORE);
    }

    @JsonProperty("scoreMad")
    public double getScoreMad() {
        return score(DetectorKind.MAD);
    }

    @JsonProperty("scoreEwma")
    public double getScoreEwma() {
        return score(DetectorKind.EWMA);
    }

    @JsonProperty("scoreHampel")
    public double getScoreHampel() {
        return score(DetectorKind.HAMPEL);
    }

    @JsonProperty("scoreRate")
    public double getScoreRate() {
        return score(DetectorKind.RATE);
    }

    @JsonProperty("isZScoreAnomaly")
    public boolean isZScoreAnomaly() {
        return isAnomaly(DetectorKind.Z_SCORE);
    }

    @JsonProperty("isMadAnomaly")
    public boolean isMadAnomaly() {
        return isAnomaly(DetectorKind.MAD);
    }

    @JsonProperty("isEwmaAnomaly")
    public boolean isEwmaAnomaly() {
        return isAnomaly(DetectorKind.EWMA);
    }

    @JsonProperty("isHampelAnomaly")
    public boolean isHampelAnomaly() {
        return isAnomaly(DetectorKind.HAMPEL);
    }

    @JsonProperty("isRateAnomaly")
    public boolean isRateAnomaly() {
        return isAnomaly(DetectorKind.RATE);
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScoredPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && timestamp.equals(that.timestamp)
                && Arrays.equals(scores, that.scores)
                && Arrays.equals(flags, that.flags)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(timestamp, value, severity);
        result = 31 * result + Arrays.hashCode(scores);
        result = 31 * result + Arrays.hashCode(flags);
        return result;
    }

    @Override
    public String toString() {
        return "ScoredPoint{" +
                "timestamp=" + timestamp +
                ", value=" + value +
                ", scores=" + Arrays.toString(scores) +
                ", triggered=" + triggeredDetectors() +
                ", severity=" + severity +
                '}';
    }
}
