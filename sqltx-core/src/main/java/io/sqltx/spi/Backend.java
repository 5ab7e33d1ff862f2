package io.sqltx.spi;

import io.sqltx.ConnectionUrl;
import io.sqltx.DatabaseKind;

import java.nio.file.Path;

/**
 * SPI for one database backend. Implementations open pools for URLs of their
 * {@link #kind() kind}.
 *
 * <p>Built-in JDBC backends: SQLite, MySQL, PostgreSQL ({@code io.sqltx.jdbc.JdbcBackends}).
 */
public interface Backend {

    /**
     * The backend this implementation serves. At most one backend per kind may be registered
     * with a gateway.
     */
    DatabaseKind kind();

    /**
     * Opens a new pool for the given URL.
     *
     * @param url           parsed connection URL whose kind equals {@link #kind()}
     * @param dataDirectory base directory for relative file-backed database paths
     * @return a new pool, exclusively owned by the caller
     * @throws io.sqltx.ConfigurationException if local resources cannot be prepared
     * @throws io.sqltx.DriverException        if the driver cannot establish the pool
     */
    DatabasePool open(ConnectionUrl url, Path dataDirectory);
}
