package io.sqltx.jdbc.backend;

import io.sqltx.DatabaseKind;
import io.sqltx.DriverException;
import io.sqltx.ExecuteResult;
import io.sqltx.jdbc.JdbcStatements;
import io.sqltx.spi.DatabaseTransaction;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A transaction on one pooled connection with auto-commit disabled. Finishing it returns the
 * connection to the pool whether or not the commit or rollback succeeded.
 *
 * <p>Auto-commit is restored only once the transaction has ended cleanly: switching it on with
 * work still pending would commit that work. After a failed rollback the connection is closed
 * as is, and the pool rolls back and resets it.
 */
final class JdbcDatabaseTransaction implements DatabaseTransaction {
    private static final Logger logger = Logger.getLogger(JdbcDatabaseTransaction.class.getName());

    private final AbstractJdbcBackend backend;
    private final Connection connection;
    private boolean completed;

    JdbcDatabaseTransaction(AbstractJdbcBackend backend, Connection connection) {
        this.backend = backend;
        this.connection = connection;
    }

    @Override
    public DatabaseKind kind() {
        return backend.kind();
    }

    @Override
    public ExecuteResult execute(String query, List<?> values) {
        ensureActive();
        return JdbcStatements.execute(connection, backend, query, values);
    }

    @Override
    public void commit() {
        ensureActive();
        SQLException failure = null;
        boolean pending = false;
        try {
            connection.commit();
        } catch (SQLException e) {
            failure = e;
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
                pending = true;
            }
        } finally {
            release(failure, pending);
        }
        if (failure != null) {
            throw new DriverException("Failed to commit transaction", failure);
        }
    }

    @Override
    public void rollback() {
        ensureActive();
        SQLException failure = null;
        try {
            connection.rollback();
        } catch (SQLException e) {
            failure = e;
        } finally {
            release(failure, failure != null);
        }
        if (failure != null) {
            throw new DriverException("Failed to roll back transaction", failure);
        }
    }

    private void ensureActive() {
        if (completed) {
            throw new IllegalStateException("Transaction already finished");
        }
    }

    private void release(SQLException failure, boolean pending) {
        completed = true;
        try {
            if (!pending) {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            if (failure != null) {
                failure.addSuppressed(e);
            } else {
                logger.log(Level.FINE, "Failed to restore auto-commit", e);
            }
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                logger.log(Level.WARNING, "Failed to release transaction connection", e);
            }
        }
    }
}
