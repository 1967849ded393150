/**
 * Domain model classes for Sensor Sentinel.
 *
 * <ul>
 * <li>{@link com.sensorsentinel.core.model.SeriesPoint} — raw reading</li>
 * <li>{@link com.sensorsentinel.core.model.ScoredPoint} — reading plus the
 * score and flag of every detector</li>
 * <li>{@link com.sensorsentinel.core.model.ThresholdSet} and
 * {@link com.sensorsentinel.core.model.ThresholdMode} — detector cutoffs</li>
 * <li>{@link com.sensorsentinel.core.model.DetectionSummary} — aggregate of one
 * pipeline run</li>
 * <li>{@link com.sensorsentinel.core.model.ContextWindow} — neighbourhood of a
 * selected anomaly</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.sensorsentinel.core.model;
