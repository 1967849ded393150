/**
 * JSON input and output contract: series snapshots in, scored points and
 * summaries out.
 */
package com.sensorsentinel.core.io;
