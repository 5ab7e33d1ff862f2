/**
 * Micrometer bridge for exporting gateway metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.sqltx.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.sqltx.spi.MetricsExporter} SPI using Micrometer counters and a gauge.
 *
 * @see io.sqltx.micrometer.MicrometerMetricsExporter
 */
package io.sqltx.micrometer;
