package com.sensorsentinel.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sensorsentinel.core.ValidationException;
import com.sensorsentinel.core.model.DetectionSummary;
import com.sensorsentinel.core.model.ScoredPoint;
import com.sensorsentinel.core.model.SeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON codec for series snapshots and detection results.
 *
 * <h3>Input</h3>
 * <p>
 * A JSON array of {@code {"timestamp": "<ISO-8601>", "value": <number>}}
 * objects. Extra fields are ignored. A record with a missing or unparseable
 * timestamp, or a missing or non-numeric value, rejects the whole snapshot.
 * </p>
 *
 * <h3>Output</h3>
 * <p>
 * Scored points and summaries are written with ISO-8601 timestamps, using the
 * field names declared on {@link ScoredPoint} and {@link DetectionSummary}.
 * </p>
 *
 * @since 1.0.0
 */
public class SnapshotCodec {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotCodec.class);

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    // ---------------------------------------------------------------
    // Read
    // ---------------------------------------------------------------

    /**
     * @param json snapshot document
     * @return the points in document order
     * @throws ValidationException if the document or any record is malformed
     */
    public List<SeriesPoint> readSeries(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return toSeries(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed snapshot JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param in snapshot document; not closed by this method
     * @return the points in document order
     * @throws ValidationException if the document or any record is malformed
     * @throws IOException         if the stream cannot be read
     */
    public List<SeriesPoint> readSeries(InputStream in) throws IOException {
        Objects.requireNonNull(in, "InputStream must not be null");
        try {
            return toSeries(mapper.readTree(in));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed snapshot JSON: " + e.getOriginalMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Write
    // ---------------------------------------------------------------

    public String writeScored(List<ScoredPoint> points) {
        Objects.requireNonNull(points, "points must not be null");
        return write(points);
    }

    public String writeSummary(DetectionSummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        return write(summary);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static List<SeriesPoint> toSeries(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new ValidationException("Snapshot must be a JSON array of {timestamp, value} records");
        }
        List<SeriesPoint> points = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            points.add(toPoint(root.get(i), i));
        }
        LOG.debug("Read snapshot of {} point(s)", points.size());
        return points;
    }

    private static SeriesPoint toPoint(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new ValidationException("Record " + index + " is not a JSON object");
        }
        JsonNode timestamp = node.get("timestamp");
        if (timestamp == null || !timestamp.isTextual()) {
            throw new ValidationException("Record " + index + " has no ISO-8601 'timestamp'");
        }
        JsonNode value = node.get("value");
        if (value == null || !value.isNumber()) {
            throw new ValidationException("Record " + index + " has no numeric 'value'");
        }
        return new SeriesPoint(parseInstant(timestamp.asText(), index), value.doubleValue());
    }

    private static Instant parseInstant(String text, int index) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException offsetFailure) {
                e.addSuppressed(offsetFailure);
                throw new ValidationException(
                        "Record " + index + " has an unparseable timestamp: '" + text + "'", e);
            }
        }
    }
}
