/**
 * JDBC implementation of the gateway's backend SPI.
 *
 * <p>{@link io.sqltx.jdbc.JdbcBackends} lists the built-in backends and
 * {@link io.sqltx.jdbc.JdbcStatements} runs statements on a connection.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.sqltx.jdbc.backend}: per-database backends, HikariCP pools and transactions</li>
 *   <li>{@code io.sqltx.jdbc.codec}: parameter binding and row decoding</li>
 * </ul>
 */
package io.sqltx.jdbc;
