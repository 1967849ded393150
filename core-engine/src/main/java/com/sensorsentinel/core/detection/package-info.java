/**
 * Anomaly detection engine.
 *
 * <p>
 * All detectors implement the
 * {@link com.sensorsentinel.core.detection.AnomalyDetector} interface and are
 * instantiated via {@link com.sensorsentinel.core.detection.DetectorFactory}.
 * Built-in detectors:
 * </p>
 * <ul>
 * <li>{@link com.sensorsentinel.core.detection.ZScoreDetector} — distance from
 * the global mean in standard deviations</li>
 * <li>{@link com.sensorsentinel.core.detection.MadDetector} — distance from the
 * global median in MADs</li>
 * <li>{@link com.sensorsentinel.core.detection.EwmaDetector} — distance from an
 * exponentially weighted mean</li>
 * <li>{@link com.sensorsentinel.core.detection.HampelDetector} — distance from
 * a rolling-window median</li>
 * <li>{@link com.sensorsentinel.core.detection.RateOfChangeDetector} — jump
 * from the previous reading</li>
 * </ul>
 *
 * <p>
 * {@link com.sensorsentinel.core.detection.DetectionPipeline} runs all of them
 * over a snapshot and merges their output.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorsentinel.core.detection;
