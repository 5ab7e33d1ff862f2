package io.sqltx.spi;

import io.sqltx.DatabaseKind;
import io.sqltx.ExecuteResult;

import java.util.List;

/**
 * An in-flight transaction on one connection.
 *
 * <p>Not thread-safe: the owning {@link io.sqltx.tx.TransactionRegistry} guarantees that no two
 * operations touch the same transaction concurrently. {@link #commit()} and
 * {@link #rollback()} consume the transaction; it must not be used afterwards, whether or not
 * they succeed.
 */
public interface DatabaseTransaction {

    DatabaseKind kind();

    /**
     * Executes a statement inside this transaction.
     *
     * @throws io.sqltx.DriverException on any driver failure
     */
    ExecuteResult execute(String query, List<?> values);

    /**
     * Commits and releases the connection.
     *
     * @throws io.sqltx.DriverException if the commit fails (the connection is released anyway)
     */
    void commit();

    /**
     * Rolls back and releases the connection.
     *
     * @throws io.sqltx.DriverException if the rollback fails (the connection is released anyway)
     */
    void rollback();
}
