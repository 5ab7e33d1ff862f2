/**
 * Service Provider Interfaces (SPI) for plugging database backends and metrics into the
 * gateway.
 *
 * @see io.sqltx.spi.Backend
 * @see io.sqltx.spi.DatabasePool
 * @see io.sqltx.spi.DatabaseTransaction
 * @see io.sqltx.spi.MetricsExporter
 */
package io.sqltx.spi;
