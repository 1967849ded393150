package com.sensorsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single sensor reading: a timestamp and a numeric value.
 *
 * <p>
 * Instances are immutable. A series handed to the detection pipeline must be
 * ordered by ascending timestamp.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;

    /**
     * @param timestamp reading time; must not be {@code null}
     * @param value     reading value
     * @throws NullPointerException if {@code timestamp} is {@code null}
     */
    public SeriesPoint(Instant timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public static SeriesPoint of(Instant timestamp, double value) {
        return new SeriesPoint(timestamp, value);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "SeriesPoint{timestamp=" + timestamp + ", value=" + value + '}';
    }
}
