/**
 * The built-in JDBC backends: SQLite ({@link io.sqltx.jdbc.backend.SqliteBackend}), MySQL
 * ({@link io.sqltx.jdbc.backend.MySqlBackend}) and PostgreSQL
 * ({@link io.sqltx.jdbc.backend.PostgresBackend}), each opening HikariCP pools.
 *
 * @see io.sqltx.jdbc.JdbcBackends
 */
package io.sqltx.jdbc.backend;
