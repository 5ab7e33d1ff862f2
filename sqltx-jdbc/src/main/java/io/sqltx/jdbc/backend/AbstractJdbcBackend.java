package io.sqltx.jdbc.backend;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.sqltx.ConnectionUrl;
import io.sqltx.DriverException;
import io.sqltx.jdbc.codec.ParameterBinder;
import io.sqltx.jdbc.codec.PositionalSql;
import io.sqltx.jdbc.codec.RowDecoder;
import io.sqltx.spi.Backend;
import io.sqltx.spi.DatabasePool;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for JDBC backends: opens a HikariCP pool per connection URL and supplies the
 * backend-specific pieces of statement execution (parameter binding, row decoding and the
 * last-insert-id lookup).
 *
 * <p>Subclasses translate the caller's URL in {@link #configure} and report the id of the last
 * inserted row in {@link #lastInsertId}.
 */
public abstract class AbstractJdbcBackend implements Backend {
    private static final Logger logger = Logger.getLogger(AbstractJdbcBackend.class.getName());
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    /** Default prefix of HikariCP pool names. */
    public static final String DEFAULT_POOL_NAME_PREFIX = "sqltx";

    private final String poolNamePrefix;
    private final ParameterBinder binder;
    private final RowDecoder decoder;

    protected AbstractJdbcBackend(String poolNamePrefix, ParameterBinder binder, RowDecoder decoder) {
        this.poolNamePrefix = Objects.requireNonNull(poolNamePrefix, "poolNamePrefix");
        this.binder = Objects.requireNonNull(binder, "binder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * Short lowercase name, e.g. {@code "postgresql"}.
     */
    public abstract String name();

    @Override
    public DatabasePool open(ConnectionUrl url, Path dataDirectory) {
        Objects.requireNonNull(url, "url");
        if (url.kind() != kind()) {
            throw new IllegalArgumentException(name() + " backend cannot open " + url.kind() + " URLs");
        }
        HikariConfig config = new HikariConfig();
        config.setPoolName(poolNamePrefix + "-" + name() + "-" + POOL_SEQUENCE.incrementAndGet());
        configure(config, url, dataDirectory);

        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new DriverException("Failed to open " + name() + " pool", e);
        }
        logger.log(Level.FINE, "Opened pool {0} on {1}", new Object[]{config.getPoolName(), config.getJdbcUrl()});
        return new JdbcDatabasePool(this, dataSource);
    }

    /**
     * Points {@code config} at the database named by {@code url}: JDBC URL, credentials and
     * any backend-specific pool settings. Pool sizing is left at the HikariCP defaults.
     *
     * @throws io.sqltx.ConfigurationException if the URL cannot be translated or local
     *                                         resources cannot be prepared
     */
    protected abstract void configure(HikariConfig config, ConnectionUrl url, Path dataDirectory);

    /**
     * Converts statement text to JDBC {@code ?} placeholders. Returns it unchanged unless the
     * backend has its own placeholder syntax.
     *
     * @throws SQLException if the placeholders do not match the values
     */
    public PositionalSql parameterize(String sql, List<?> values) throws SQLException {
        return new PositionalSql(sql, values);
    }

    /**
     * Prepares a data-modifying statement. Backends that read generated keys override this.
     */
    public PreparedStatement prepareUpdate(Connection conn, String sql) throws SQLException {
        return conn.prepareStatement(sql);
    }

    /**
     * Returns the decimal id of the last row inserted on {@code conn}, or {@code null} if the
     * backend does not report one. Called right after {@code ps} has executed.
     */
    public abstract String lastInsertId(Connection conn, PreparedStatement ps) throws SQLException;

    public ParameterBinder binder() {
        return binder;
    }

    public RowDecoder decoder() {
        return decoder;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + poolNamePrefix + "]";
    }
}
