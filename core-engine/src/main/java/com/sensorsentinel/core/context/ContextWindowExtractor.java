package com.sensorsentinel.core.context;

import com.sensorsentinel.core.config.DetectionConfig;
import com.sensorsentinel.core.model.ContextWindow;
import com.sensorsentinel.core.model.DetectionSummary;
import com.sensorsentinel.core.model.ScoredPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Extracts the readings surrounding a selected anomaly.
 *
 * <p>
 * The window spans {@code radius} points on each side of the anchor, clamped
 * to the series bounds. The anchor is located by exact timestamp match; the
 * first match wins.
 * </p>
 *
 * @since 1.0.0
 */
public class ContextWindowExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ContextWindowExtractor.class);

    public static final int DEFAULT_RADIUS = 5;

    private final int radius;

    public ContextWindowExtractor() {
        this(DEFAULT_RADIUS);
    }

    public ContextWindowExtractor(DetectionConfig config) {
        this(Objects.requireNonNull(config, "DetectionConfig must not be null").getContextRadius());
    }

    /**
     * @param radius points kept on each side of the anchor; must be &gt;= 0
     */
    public ContextWindowExtractor(int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("radius must be >= 0, got: " + radius);
        }
        this.radius = radius;
    }

    /**
     * @param series scored series in timestamp order
     * @param anchor selected point, possibly from an earlier run; matched by
     *               timestamp only
     * @return the neighbourhood of {@code anchor}, anchored on the series' own
     *         point, or an empty window if the series does not contain it
     */
    public ContextWindow extract(List<ScoredPoint> series, ScoredPoint anchor) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(anchor, "anchor must not be null");

        int index = indexOf(series, anchor);
        if (index < 0) {
            LOG.debug("Anchor {} not found in series of {} point(s)", anchor.getTimestamp(), series.size());
            return ContextWindow.empty();
        }
        int from = Math.max(0, index - radius);
        int to = Math.min(series.size(), index + radius + 1);
        return new ContextWindow(series.get(index), from, series.subList(from, to));
    }

    /**
     * @return the earliest anomaly of the run, if any
     */
    public Optional<ScoredPoint> defaultAnchor(DetectionSummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        List<ScoredPoint> anomalies = summary.getAnomalies();
        return anomalies.isEmpty() ? Optional.empty() : Optional.of(anomalies.get(0));
    }

    /**
     * Window around the operator's selection, or around the default anchor
     * when nothing is selected.
     *
     * @param summary   result of the current run
     * @param selection explicitly selected point, if any
     * @return the context window; empty if there is no anchor
     */
    public ContextWindow select(DetectionSummary summary, Optional<ScoredPoint> selection) {
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(selection, "selection must not be null");
        Optional<ScoredPoint> anchor = selection.isPresent() ? selection : defaultAnchor(summary);
        return anchor.map(a -> extract(summary.getPoints(), a)).orElseGet(ContextWindow::empty);
    }

    public int getRadius() {
        return radius;
    }

    private static int indexOf(List<ScoredPoint> series, ScoredPoint anchor) {
        for (int i = 0; i < series.size(); i++) {
            if (series.get(i).getTimestamp().equals(anchor.getTimestamp())) {
                return i;
            }
        }
        return -1;
    }
}
