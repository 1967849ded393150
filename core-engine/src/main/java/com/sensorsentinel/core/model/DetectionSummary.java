package com.sensorsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one detection pipeline run.
 *
 * <p>
 * Holds the full scored series, the anomaly subset (points flagged by at
 * least one detector, in timestamp order, each point exactly once), the
 * number of points each detector flagged, the number of anomalies per
 * {@link Severity}, and the thresholds the run used.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "totalPoints", "totalAnomalies", "thresholds", "counts", "severityCounts", "anomalies" })
public final class DetectionSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<ScoredPoint> points;
    private final List<ScoredPoint> anomalies;
    private final Map<DetectorKind, Integer> counts;
    private final Map<Severity, Integer> severityCounts;
    private final ThresholdSet thresholds;

    /**
     * Derive the summary from a scored series.
     *
     * @param points     every scored point of the run, in timestamp order
     * @param thresholds thresholds the points were scored against
     */
    public DetectionSummary(List<ScoredPoint> points, ThresholdSet thresholds) {
        Objects.requireNonNull(points, "points must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        this.points = List.copyOf(points);

        Map<DetectorKind, Integer> detectorCounts = new EnumMap<>(DetectorKind.class);
        for (DetectorKind kind : DetectorKind.values()) {
            detectorCounts.put(kind, 0);
        }
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            if (severity != Severity.NONE) {
                bySeverity.put(severity, 0);
            }
        }

        List<ScoredPoint> flagged = new ArrayList<>();
        for (ScoredPoint point : this.points) {
            for (DetectorKind kind : point.triggeredDetectors()) {
                detectorCounts.merge(kind, 1, Integer::sum);
            }
            if (point.isAnomaly()) {
                flagged.add(point);
                bySeverity.merge(point.getSeverity(), 1, Integer::sum);
            }
        }

        this.anomalies = Collections.unmodifiableList(flagged);
        this.counts = Collections.unmodifiableMap(detectorCounts);
        this.severityCounts = Collections.unmodifiableMap(bySeverity);
    }

    /**
     * @return every scored point, unmodifiable
     */
    @JsonIgnore
    public List<ScoredPoint> getPoints() {
        return points;
    }

    /**
     * @return anomalous points in timestamp order, unmodifiable
     */
    @JsonProperty("anomalies")
    public List<ScoredPoint> getAnomalies() {
        return anomalies;
    }

    public int count(DetectorKind kind) {
        return counts.get(kind);
    }

    public int count(Severity severity) {
        return severityCounts.getOrDefault(severity, 0);
    }

    @JsonIgnore
    public Map<DetectorKind, Integer> getCounts() {
        return counts;
    }

    @JsonProperty("counts")
    public Map<String, Integer> countsByKey() {
        Map<String, Integer> byKey = new LinkedHashMap<>();
        counts.forEach((kind, count) -> byKey.put(kind.key(), count));
        return byKey;
    }

    @JsonProperty("severityCounts")
    public Map<Severity, Integer> getSeverityCounts() {
        return severityCounts;
    }

    @JsonProperty("thresholds")
    public ThresholdSet getThresholds() {
        return thresholds;
    }

    @JsonProperty("totalPoints")
    public int getTotalPoints() {
        return points.size();
    }

    @JsonProperty("totalAnomalies")
    public int getTotalAnomalies() {
        return anomalies.size();
    }

    @JsonIgnore
    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionSummary that))
            return false;
        return points.equals(that.points) && thresholds.equals(that.thresholds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(points, thresholds);
    }

    @Override
    public String toString() {
        return "DetectionSummary{" +
                "points=" + points.size() +
                ", anomalies=" + anomalies.size() +
                ", counts=" + counts +
                ", severityCounts=" + severityCounts +
                ", thresholds=" + thresholds +
                '}';
    }
}
