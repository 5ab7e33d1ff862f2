package io.sqltx.spi;

import io.sqltx.DatabaseKind;
import io.sqltx.ExecuteResult;

import java.util.List;
import java.util.Map;

/**
 * A reusable set of open connections to one database.
 *
 * <p>Implementations must be safe for concurrent use; statements issued against the same
 * pool may interleave freely.
 *
 * <p>Parameter values are bound positionally and classified with
 * {@link io.sqltx.value.ValueKind}. Rows are returned as insertion-ordered maps whose values are
 * {@code null}, {@link String}, {@link Long}, {@link Double} or {@link Boolean}.
 */
public interface DatabasePool extends AutoCloseable {

    DatabaseKind kind();

    /**
     * Executes a statement on a connection borrowed for the duration of the call.
     *
     * @throws io.sqltx.DriverException on any driver failure
     */
    ExecuteResult execute(String query, List<?> values);

    /**
     * Runs a query and materializes every row.
     *
     * @throws io.sqltx.DriverException on any driver failure
     */
    List<Map<String, Object>> select(String query, List<?> values);

    /**
     * Opens a transaction on a dedicated connection which stays checked out until the
     * transaction is finished.
     *
     * @throws io.sqltx.DriverException if no connection can be obtained or the transaction
     *                                  cannot be started
     */
    DatabaseTransaction begin();

    /**
     * Releases all connections of this pool.
     */
    @Override
    void close();
}
