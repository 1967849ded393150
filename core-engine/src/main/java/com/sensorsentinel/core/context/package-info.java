/**
 * Anomaly drill-down: context windows around a selected point and free-text
 * search over the anomaly list.
 */
package com.sensorsentinel.core.context;
