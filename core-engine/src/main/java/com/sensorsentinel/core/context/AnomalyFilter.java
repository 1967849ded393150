package com.sensorsentinel.core.context;

import com.sensorsentinel.core.model.DetectorKind;
import com.sensorsentinel.core.model.ScoredPoint;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Free-text search over a list of anomalies.
 *
 * <p>
 * A point matches when the query occurs, ignoring case, in its ISO-8601
 * timestamp, its severity name, the label of any detector that flagged it, or
 * its value written without trailing zeros ({@code 42}, {@code 42.5}).
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyFilter {

    private AnomalyFilter() {
        // static helpers only
    }

    /**
     * @param anomalies points to search, order is kept
     * @param query     search text; {@code null} or blank keeps everything
     * @return matching points
     */
    public static List<ScoredPoint> matching(List<ScoredPoint> anomalies, String query) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        if (query == null || query.isBlank()) {
            return List.copyOf(anomalies);
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return anomalies.stream()
                .filter(point -> matches(point, needle))
                .collect(Collectors.toUnmodifiableList());
    }

    static boolean matches(ScoredPoint point, String needle) {
        if (contains(point.getTimestamp().toString(), needle)
                || contains(point.getSeverity().name(), needle)
                || contains(valueText(point.getValue()), needle)) {
            return true;
        }
        for (DetectorKind kind : point.triggeredDetectors()) {
            if (contains(kind.label(), needle)) {
                return true;
            }
        }
        return false;
    }

    static String valueText(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static boolean contains(String haystack, String needle) {
        return haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
