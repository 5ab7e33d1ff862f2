package io.sqltx.jdbc.backend;

import com.zaxxer.hikari.HikariDataSource;
import io.sqltx.DatabaseKind;
import io.sqltx.DriverException;
import io.sqltx.ExecuteResult;
import io.sqltx.jdbc.JdbcStatements;
import io.sqltx.spi.DatabasePool;
import io.sqltx.spi.DatabaseTransaction;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link DatabasePool} over a {@link HikariDataSource}. Each statement borrows a connection for
 * its own duration; a transaction keeps its connection until it is finished.
 */
final class JdbcDatabasePool implements DatabasePool {
    private final AbstractJdbcBackend backend;
    private final HikariDataSource dataSource;

    JdbcDatabasePool(AbstractJdbcBackend backend, HikariDataSource dataSource) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public DatabaseKind kind() {
        return backend.kind();
    }

    @Override
    public ExecuteResult execute(String query, List<?> values) {
        try (Connection conn = dataSource.getConnection()) {
            return JdbcStatements.execute(conn, backend, query, values);
        } catch (SQLException e) {
            throw new DriverException("Failed to acquire connection", e);
        }
    }

    @Override
    public List<Map<String, Object>> select(String query, List<?> values) {
        try (Connection conn = dataSource.getConnection()) {
            return JdbcStatements.select(conn, backend, query, values);
        } catch (SQLException e) {
            throw new DriverException("Failed to acquire connection", e);
        }
    }

    @Override
    public DatabaseTransaction begin() {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new DriverException("Failed to acquire connection", e);
        }
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new DriverException("Failed to begin transaction", e);
        }
        return new JdbcDatabaseTransaction(backend, connection);
    }

    @Override
    public void close() {
        dataSource.close();
    }

    @Override
    public String toString() {
        return "JdbcDatabasePool[" + dataSource.getPoolName() + "]";
    }
}
