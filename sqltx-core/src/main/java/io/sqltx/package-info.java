/**
 * Root API of sqltx, a multi-backend SQL gateway with handle-addressed transactions.
 *
 * <h2>Core Design</h2>
 * <p>A caller {@linkplain io.sqltx.SqlGateway#connect(String) connects} by URL; the URL itself is
 * the handle for later statements. Pools live in a {@linkplain io.sqltx.pool.PoolRegistry pool
 * registry}; transactions that span several calls live in a
 * {@linkplain io.sqltx.tx.TransactionRegistry transaction registry} under random identifiers
 * and stay open until the caller commits or rolls back.
 *
 * <p>Parameters are classified by {@link io.sqltx.value.ValueKind} and bound positionally;
 * rows come back as ordered maps of {@code null}, {@code String}, {@code Long},
 * {@code Double} and {@code Boolean} values, decoded by an ordered sequence of type probes per
 * backend.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>sqltx-core</b>: API, registries, SPI (zero external deps)</li>
 *   <li><b>sqltx-jdbc</b>: SQLite, MySQL and PostgreSQL backends on HikariCP</li>
 *   <li><b>sqltx-micrometer</b>: optional Micrometer metrics bridge</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * <p>All failures extend {@link io.sqltx.SqlGatewayException}:
 * {@link io.sqltx.ConfigurationException}, {@link io.sqltx.DatabaseNotFoundException},
 * {@link io.sqltx.TransactionNotFoundException} and {@link io.sqltx.DriverException}.
 *
 * @see io.sqltx.SqlGateway
 * @see io.sqltx.AsyncSqlGateway
 * @see io.sqltx.ExecuteResult
 */
package io.sqltx;
