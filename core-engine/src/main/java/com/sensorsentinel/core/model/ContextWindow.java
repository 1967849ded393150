package com.sensorsentinel.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Contiguous neighbourhood of scored points around an anchor.
 *
 * <p>
 * A read-only view used to show the readings surrounding a selected anomaly.
 * An empty window has no anchor.
 * </p>
 *
 * @since 1.0.0
 */
public final class ContextWindow {

    private static final ContextWindow EMPTY = new ContextWindow(null, 0, List.of());

    private final ScoredPoint anchor;
    private final int startIndex;
    private final List<ScoredPoint> points;

    /**
     * @param anchor     the selected point; may be {@code null} only for an empty
     *                   window
     * @param startIndex index of the first window point in the source series
     * @param points     window contents in timestamp order
     */
    public ContextWindow(ScoredPoint anchor, int startIndex, List<ScoredPoint> points) {
        Objects.requireNonNull(points, "points must not be null");
        if (startIndex < 0) {
            throw new IllegalArgumentException("startIndex must be >= 0, got: " + startIndex);
        }
        this.anchor = anchor;
        this.startIndex = startIndex;
        this.points = List.copyOf(points);
    }

    public static ContextWindow empty() {
        return EMPTY;
    }

    public Optional<ScoredPoint> getAnchor() {
        return Optional.ofNullable(anchor);
    }

    public int getStartIndex() {
        return startIndex;
    }

    /**
     * @return exclusive end index in the source series
     */
    public int getEndIndex() {
        return startIndex + points.size();
    }

    public List<ScoredPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    @Override
    public String toString() {
        return "ContextWindow{anchor=" + (anchor != null ? anchor.getTimestamp() : null)
                + ", range=[" + startIndex + ", " + getEndIndex() + ")}";
    }
}
