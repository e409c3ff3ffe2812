/**
 * Micrometer bridge for pgcom metrics.
 *
 * <p>Pass a {@link io.pgcom.micrometer.MicrometerMetricsExporter} to the connector, executor
 * and listener builders to publish pool, command and listener counters.
 */
package io.pgcom.micrometer;
