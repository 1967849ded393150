/**
 * Pure estimators (median, median absolute deviation, mean, population
 * standard deviation) used by the detectors.
 *
 * @since 1.0.0
 */
package com.sensorsentinel.core.stats;
