package io.sqltx.jdbc;

import io.sqltx.DatabaseKind;
import io.sqltx.jdbc.backend.AbstractJdbcBackend;
import io.sqltx.jdbc.backend.MySqlBackend;
import io.sqltx.jdbc.backend.PostgresBackend;
import io.sqltx.jdbc.backend.SqliteBackend;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * The built-in JDBC backends.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Every backend, for SqlGateway.builder().backends(...)
 * List<AbstractJdbcBackend> all = JdbcBackends.all();
 *
 * // Pools named "myapp-postgresql-1", "myapp-sqlite-2", ...
 * List<AbstractJdbcBackend> named = JdbcBackends.all("myapp");
 *
 * // By kind or by name
 * AbstractJdbcBackend sqlite = JdbcBackends.get(DatabaseKind.SQLITE);
 * AbstractJdbcBackend postgres = JdbcBackends.get("postgresql");
 * }</pre>
 */
public final class JdbcBackends {

    private static final List<AbstractJdbcBackend> BACKENDS = all(AbstractJdbcBackend.DEFAULT_POOL_NAME_PREFIX);

    private JdbcBackends() {
    }

    /**
     * Returns the SQLite, MySQL and PostgreSQL backends with the default pool name prefix.
     */
    public static List<AbstractJdbcBackend> all() {
        return BACKENDS;
    }

    /**
     * Returns new SQLite, MySQL and PostgreSQL backends whose pools are named with
     * {@code poolNamePrefix}.
     */
    public static List<AbstractJdbcBackend> all(String poolNamePrefix) {
        Objects.requireNonNull(poolNamePrefix, "poolNamePrefix");
        return List.of(
                new SqliteBackend(poolNamePrefix),
                new MySqlBackend(poolNamePrefix),
                new PostgresBackend(poolNamePrefix));
    }

    /**
     * Gets the backend for a kind.
     */
    public static AbstractJdbcBackend get(DatabaseKind kind) {
        Objects.requireNonNull(kind, "kind");
        for (AbstractJdbcBackend backend : BACKENDS) {
            if (backend.kind() == kind) {
                return backend;
            }
        }
        throw new IllegalArgumentException("No JDBC backend for " + kind);
    }

    /**
     * Gets a backend by name.
     *
     * @param name backend name (case-insensitive): {@code sqlite}, {@code mysql} or
     *             {@code postgresql}
     * @throws IllegalArgumentException if no backend has that name
     */
    public static AbstractJdbcBackend get(String name) {
        Objects.requireNonNull(name, "name");
        for (AbstractJdbcBackend backend : BACKENDS) {
            if (backend.name().equals(name.toLowerCase(Locale.ROOT))) {
                return backend;
            }
        }
        throw new IllegalArgumentException("Unknown backend: " + name
                + ". Available: " + BACKENDS.stream().map(AbstractJdbcBackend::name).toList());
    }
}
