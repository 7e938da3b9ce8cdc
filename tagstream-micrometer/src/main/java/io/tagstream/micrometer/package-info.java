/**
 * Micrometer metrics integration for tagstream.
 *
 * @see io.tagstream.micrometer.MicrometerMetricsExporter
 */
package io.tagstream.micrometer;
