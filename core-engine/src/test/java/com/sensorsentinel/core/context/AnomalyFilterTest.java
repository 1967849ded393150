package com.sensorsentinel.core.context;

import com.sensorsentinel.core.model.DetectorKind;
import com.sensorsentinel.core.model.ScoredPoint;
import com.sensorsentinel.core.model.SeriesPoint;
import com.sensorsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalyFilter}.
 */
class AnomalyFilterTest {

    private final ScoredPoint morningSpike = anomaly("2024-03-01T08:15:00Z", 42.5, Severity.CRITICAL,
            DetectorKind.Z_SCORE, DetectorKind.MAD);
    private final ScoredPoint eveningDrop = anomaly("2024-03-01T19:40:00Z", 3.0, Severity.MEDIUM,
            DetectorKind.RATE);
    private final List<ScoredPoint> anomalies = List.of(morningSpike, eveningDrop);

    @Test
    @DisplayName("A blank query keeps every anomaly")
    void blankQuery() {
        assertThat(AnomalyFilter.matching(anomalies, null)).containsExactly(morningSpike, eveningDrop);
        assertThat(AnomalyFilter.matching(anomalies, "  ")).containsExactly(morningSpike, eveningDrop);
    }

    @Test
    @DisplayName("Should match on the timestamp")
    void matchesTimestamp() {
        assertThat(AnomalyFilter.matching(anomalies, "T19:40")).containsExactly(eveningDrop);
    }

    @Test
    @DisplayName("Should match on severity ignoring case")
    void matchesSeverity() {
        assertThat(AnomalyFilter.matching(anomalies, "critical")).containsExactly(morningSpike);
    }

    @Test
    @DisplayName("Should match on the label of a detector that fired")
    void matchesDetectorLabel() {
        assertThat(AnomalyFilter.matching(anomalies, "rate-of")).containsExactly(eveningDrop);
        assertThat(AnomalyFilter.matching(anomalies, "hampel")).isEmpty();
    }

    @Test
    @DisplayName("Should match on the value without trailing zeros")
    void matchesValue() {
        assertThat(AnomalyFilter.matching(anomalies, "42.5")).containsExactly(morningSpike);
        assertThat(AnomalyFilter.valueText(3.0)).isEqualTo("3");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ScoredPoint anomaly(String timestamp, double value, Severity severity, DetectorKind... fired) {
        ScoredPoint.Builder builder = ScoredPoint.builder(SeriesPoint.of(Instant.parse(timestamp), value));
        for (DetectorKind kind : fired) {
            builder.score(kind, 10, true);
        }
        return builder.severity(severity).build();
    }
}
