package io.sqltx.spi;

/**
 * Observability hook for exporting gateway counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of pools opened by {@code connect}.
     */
    void incrementConnects();

    /**
     * Increments the count of statements executed, inside or outside a transaction.
     */
    void incrementStatements();

    /**
     * Increments the count of queries materialized by {@code select}.
     */
    void incrementSelects();

    /**
     * Increments the count of operations that failed with a driver error.
     */
    void incrementFailures();

    /**
     * Increments the count of transactions begun.
     */
    void incrementTransactionsBegun();

    /**
     * Increments the count of transactions committed successfully.
     */
    void incrementTransactionsCommitted();

    /**
     * Increments the count of transactions rolled back on request.
     */
    void incrementTransactionsRolledBack();

    /**
     * Increments the count of idle transactions rolled back by the reaper.
     */
    default void incrementTransactionsEvicted() {
    }

    /**
     * Records the number of transactions currently registered.
     *
     * @param count active transaction count (always non-negative)
     */
    void recordActiveTransactions(int count);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementConnects() {
        }

        @Override
        public void incrementStatements() {
        }

        @Override
        public void incrementSelects() {
        }

        @Override
        public void incrementFailures() {
        }

        @Override
        public void incrementTransactionsBegun() {
        }

        @Override
        public void incrementTransactionsCommitted() {
        }

        @Override
        public void incrementTransactionsRolledBack() {
        }

        @Override
        public void recordActiveTransactions(int count) {
        }
    }
}
