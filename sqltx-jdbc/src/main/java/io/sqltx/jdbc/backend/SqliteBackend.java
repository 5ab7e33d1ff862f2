package io.sqltx.jdbc.backend;

import com.zaxxer.hikari.HikariConfig;
import io.sqltx.ConfigurationException;
import io.sqltx.ConnectionUrl;
import io.sqltx.DatabaseKind;
import io.sqltx.jdbc.codec.ParameterBinder;
import io.sqltx.jdbc.codec.SqliteRowDecoder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SQLite backend on the xerial {@code sqlite-jdbc} driver.
 *
 * <p>{@code sqlite::memory:} opens a new private in-memory database. Its connections share one
 * cache, so every connection of the pool sees the same data, and the pool keeps connections
 * open for its whole life so the database is not dropped. Any other
 * {@code sqlite:<path>} is resolved against the data directory (absolute paths stay as they
 * are); the directory is created if it does not exist. Query parameters after {@code ?} in a
 * file path are ignored.
 */
public final class SqliteBackend extends AbstractJdbcBackend {
    static final String MEMORY = ":memory:";
    private static final AtomicInteger MEMORY_SEQUENCE = new AtomicInteger();

    public SqliteBackend() {
        this(DEFAULT_POOL_NAME_PREFIX);
    }

    public SqliteBackend(String poolNamePrefix) {
        super(poolNamePrefix, new ParameterBinder(), new SqliteRowDecoder());
    }

    @Override
    public DatabaseKind kind() {
        return DatabaseKind.SQLITE;
    }

    @Override
    public String name() {
        return "sqlite";
    }

    @Override
    protected void configure(HikariConfig config, ConnectionUrl url, Path dataDirectory) {
        if (MEMORY.equals(url.body())) {
            config.setJdbcUrl("jdbc:sqlite:file:sqltx-mem-" + MEMORY_SEQUENCE.incrementAndGet()
                    + "?mode=memory&cache=shared");
            // the database lives only as long as one of its connections
            config.setMaxLifetime(0);
        } else {
            config.setJdbcUrl("jdbc:sqlite:" + databaseFile(url, dataDirectory));
        }
    }

    static Path databaseFile(ConnectionUrl url, Path dataDirectory) {
        String body = url.body();
        int query = body.indexOf('?');
        String path = query >= 0 ? body.substring(0, query) : body;
        Path file;
        try {
            file = dataDirectory.resolve(path);
        } catch (InvalidPathException e) {
            throw new ConfigurationException("Invalid URL: " + url.raw(), e);
        }
        try {
            Files.createDirectories(dataDirectory);
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to create data directory for " + file, e);
        }
        return file;
    }

    @Override
    public String lastInsertId(Connection conn, PreparedStatement ps) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? Long.toString(rs.getLong(1)) : "0";
        }
    }
}
