package io.sqltx;

import io.sqltx.pool.PoolRegistry;
import io.sqltx.spi.Backend;
import io.sqltx.spi.MetricsExporter;
import io.sqltx.tx.TransactionReaper;
import io.sqltx.tx.TransactionRegistry;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that owns a {@link PoolRegistry} and a {@link TransactionRegistry} and exposes
 * one uniform execute/select/transaction API over every configured backend.
 *
 * <p>All state lives in the instance, so independent gateways can coexist (for example one per
 * test). Every operation is safe to call from multiple threads.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SqlGateway gateway = SqlGateway.builder()
 *     .backends(JdbcBackends.all())
 *     .dataDirectory(Path.of("/var/lib/myapp"))
 *     .build()) {
 *   String db = gateway.connect("sqlite::memory:");
 *   gateway.execute(db, "CREATE TABLE t(id INTEGER PRIMARY KEY, name TEXT)");
 *   String txId = gateway.beginTransaction(db);
 *   gateway.executeInTransaction(txId, "INSERT INTO t(name) VALUES (?)", List.of("Alice"));
 *   gateway.commit(txId);
 *   List<Map<String, Object>> rows = gateway.select(db, "SELECT id, name FROM t");
 * }
 * }</pre>
 *
 * @see Builder
 * @see AsyncSqlGateway
 */
public final class SqlGateway implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(SqlGateway.class.getName());

    private final PoolRegistry pools;
    private final TransactionRegistry transactions;
    private final TransactionReaper reaper;
    private final MetricsExporter metrics;

    private SqlGateway(Builder builder) {
        if (builder.backends.isEmpty()) {
            throw new IllegalArgumentException("at least one backend is required");
        }
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.pools = new PoolRegistry(builder.backends, builder.dataDirectory);
        this.transactions = new TransactionRegistry(clock);
        if (builder.transactionIdleTimeout != null) {
            this.reaper = TransactionReaper.builder()
                    .registry(transactions)
                    .idleTimeout(builder.transactionIdleTimeout)
                    .interval(builder.reaperInterval)
                    .metrics(metrics)
                    .clock(clock)
                    .build();
            reaper.start();
        } else {
            this.reaper = null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Echoes {@code value}; used by transports as a liveness check.
     *
     * @param value any value, possibly {@code null}
     * @return {@code value}
     */
    public String ping(String value) {
        return value;
    }

    /**
     * Opens a pool for {@code url} and registers it under the URL, replacing any pool already
     * registered under the same URL.
     *
     * @param url {@code sqlite:<path>}, {@code sqlite::memory:}, {@code mysql://...},
     *            {@code postgres://...} or {@code postgresql://...}
     * @return the connection handle, equal to {@code url}
     * @throws ConfigurationException if the URL is malformed or unsupported
     * @throws DriverException        if the database cannot be reached
     */
    public String connect(String url) {
        String handle = driverCall(() -> pools.connect(url));
        metrics.incrementConnects();
        return handle;
    }

    /**
     * Executes a statement without parameters on a pooled connection.
     *
     * @see #execute(String, String, List)
     */
    public ExecuteResult execute(String db, String query) {
        return execute(db, query, List.of());
    }

    /**
     * Executes a statement on a pooled connection, outside any transaction.
     *
     * @param db     connection handle returned by {@link #connect}
     * @param query  statement text with positional placeholders
     * @param values parameter values in placeholder order
     * @throws DatabaseNotFoundException if {@code db} is not connected
     * @throws DriverException           if the statement fails
     */
    public ExecuteResult execute(String db, String query, List<?> values) {
        Objects.requireNonNull(values, "values");
        var pool = pools.get(db);
        ExecuteResult result = driverCall(() -> pool.execute(query, values));
        metrics.incrementStatements();
        return result;
    }

    /**
     * Runs a query without parameters.
     *
     * @see #select(String, String, List)
     */
    public List<Map<String, Object>> select(String db, String query) {
        return select(db, query, List.of());
    }

    /**
     * Runs a query on a pooled connection and returns every row. Each row maps column names to
     * values in the column order reported by the database.
     *
     * @throws DatabaseNotFoundException if {@code db} is not connected
     * @throws DriverException           if the query fails
     */
    public List<Map<String, Object>> select(String db, String query, List<?> values) {
        Objects.requireNonNull(values, "values");
        var pool = pools.get(db);
        List<Map<String, Object>> rows = driverCall(() -> pool.select(query, values));
        metrics.incrementSelects();
        return rows;
    }

    /**
     * Begins a transaction on a dedicated connection of the {@code db} pool.
     *
     * @return the transaction identifier
     * @throws DatabaseNotFoundException if {@code db} is not connected
     * @throws DriverException           if the transaction cannot be started
     */
    public String beginTransaction(String db) {
        var pool = pools.get(db);
        String txId = driverCall(() -> transactions.begin(pool));
        metrics.incrementTransactionsBegun();
        metrics.recordActiveTransactions(transactions.size());
        return txId;
    }

    /**
     * Executes a statement without parameters inside a transaction.
     *
     * @see #executeInTransaction(String, String, List)
     */
    public ExecuteResult executeInTransaction(String txId, String query) {
        return executeInTransaction(txId, query, List.of());
    }

    /**
     * Executes a statement inside an active transaction. The transaction stays active.
     *
     * @throws TransactionNotFoundException if {@code txId} is unknown or already finished
     * @throws DriverException              if the statement fails
     */
    public ExecuteResult executeInTransaction(String txId, String query, List<?> values) {
        Objects.requireNonNull(values, "values");
        ExecuteResult result = driverCall(() -> transactions.execute(txId, query, values));
        metrics.incrementStatements();
        return result;
    }

    /**
     * Commits a transaction. The identifier is invalid afterwards, even if the commit fails.
     *
     * @throws TransactionNotFoundException if {@code txId} is unknown or already finished
     * @throws DriverException              if the commit fails
     */
    public void commit(String txId) {
        try {
            driverCall(() -> {
                transactions.commit(txId);
                return null;
            });
        } finally {
            metrics.recordActiveTransactions(transactions.size());
        }
        metrics.incrementTransactionsCommitted();
    }

    /**
     * Rolls back a transaction. The identifier is invalid afterwards, even if the rollback fails.
     *
     * @throws TransactionNotFoundException if {@code txId} is unknown or already finished
     * @throws DriverException              if the rollback fails
     */
    public void rollback(String txId) {
        try {
            driverCall(() -> {
                transactions.rollback(txId);
                return null;
            });
        } finally {
            metrics.recordActiveTransactions(transactions.size());
        }
        metrics.incrementTransactionsRolledBack();
    }

    /**
     * Returns the connection handles currently registered.
     */
    public Set<String> connectedDatabases() {
        return pools.identifiers();
    }

    /**
     * Returns the number of active transactions.
     */
    public int activeTransactionCount() {
        return transactions.size();
    }

    /**
     * Returns a view of this gateway whose operations run on {@code executor}.
     *
     * @param executor executor for the blocking driver calls
     * @return an asynchronous view sharing this gateway's state
     */
    public AsyncSqlGateway async(Executor executor) {
        return new AsyncSqlGateway(this, executor);
    }

    /**
     * Shuts down in order: reaper, remaining transactions (rolled back), pools.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        if (reaper != null) {
            try {
                reaper.close();
            } catch (RuntimeException e) {
                first = e;
            }
        }
        int rolledBack = transactions.rollbackAll();
        if (rolledBack > 0) {
            logger.log(Level.WARNING, "Rolled back {0} unfinished transactions on close", rolledBack);
            metrics.recordActiveTransactions(0);
        }
        try {
            pools.close();
        } catch (RuntimeException e) {
            if (first == null) first = e; else first.addSuppressed(e);
        }
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    private <T> T driverCall(Supplier<T> call) {
        try {
            return call.get();
        } catch (DriverException e) {
            metrics.incrementFailures();
            throw e;
        }
    }

    /** Builder for {@link SqlGateway}. */
    public static final class Builder {
        private final List<Backend> backends = new ArrayList<>();
        private Path dataDirectory = Path.of(System.getProperty("user.home"), ".sqltx");
        private Duration transactionIdleTimeout;
        private Duration reaperInterval = Duration.ofSeconds(30);
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {}

        /**
         * Adds a backend.
         *
         * <p><b>Required</b> (at least one). At most one backend per {@link DatabaseKind}.
         *
         * @param backend the backend
         * @return this builder
         */
        public Builder backend(Backend backend) {
            this.backends.add(Objects.requireNonNull(backend, "backend"));
            return this;
        }

        /**
         * Adds several backends, e.g. {@code JdbcBackends.all()}.
         *
         * @param backends the backends
         * @return this builder
         */
        public Builder backends(Collection<? extends Backend> backends) {
            Objects.requireNonNull(backends, "backends").forEach(this::backend);
            return this;
        }

        /**
         * Sets the directory that relative SQLite paths are resolved against. Created on demand
         * when the first file-backed SQLite database is connected.
         *
         * <p>Optional. Defaults to {@code ${user.home}/.sqltx}.
         *
         * @param dataDirectory the data directory
         * @return this builder
         */
        public Builder dataDirectory(Path dataDirectory) {
            this.dataDirectory = Objects.requireNonNull(dataDirectory, "dataDirectory");
            return this;
        }

        /**
         * Enables rolling back transactions that have not run a statement for the given time.
         *
         * <p>Optional. Transactions never expire unless this is set. Must be &gt; 0.
         *
         * @param transactionIdleTimeout the idle timeout
         * @return this builder
         */
        public Builder transactionIdleTimeout(Duration transactionIdleTimeout) {
            this.transactionIdleTimeout = transactionIdleTimeout;
            return this;
        }

        /**
         * Sets how often idle transactions are looked for. Only used together with
         * {@link #transactionIdleTimeout(Duration)}.
         *
         * <p>Optional. Defaults to {@code 30 seconds}. Must be &gt; 0.
         *
         * @param reaperInterval the interval between sweeps
         * @return this builder
         */
        public Builder reaperInterval(Duration reaperInterval) {
            this.reaperInterval = Objects.requireNonNull(reaperInterval, "reaperInterval");
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}. Closed together with the gateway
         * if it implements {@link AutoCloseable}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metricsExporter(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock used to track transaction idleness.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the gateway, starting the idle reaper if configured.
         *
         * @return a new {@link SqlGateway}
         * @throws IllegalArgumentException if no backend was added, two backends share a kind,
         *                                  or a duration is not positive
         */
        public SqlGateway build() {
            return new SqlGateway(this);
        }
    }
}
