package io.sqltx.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.sqltx.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code sqltx.connects} - pools opened</li>
 *   <li>{@code sqltx.statements} - statements executed, in or out of a transaction</li>
 *   <li>{@code sqltx.selects} - queries materialized</li>
 *   <li>{@code sqltx.failures} - operations failed with a driver error</li>
 *   <li>{@code sqltx.transactions.begun} - transactions begun</li>
 *   <li>{@code sqltx.transactions.committed} - transactions committed</li>
 *   <li>{@code sqltx.transactions.rolledback} - transactions rolled back on request</li>
 *   <li>{@code sqltx.transactions.evicted} - idle transactions rolled back by the reaper</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code sqltx.transactions.active} - transactions currently registered</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter connects;
    private final Counter statements;
    private final Counter selects;
    private final Counter failures;
    private final Counter transactionsBegun;
    private final Counter transactionsCommitted;
    private final Counter transactionsRolledBack;
    private final Counter transactionsEvicted;
    private final Gauge activeTransactionsGauge;

    private final AtomicInteger activeTransactions = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "sqltx"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "sqltx");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-gateway use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "reports.sqltx"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.connects = Counter.builder(namePrefix + ".connects")
                .description("Pools opened")
                .register(registry);
        this.statements = Counter.builder(namePrefix + ".statements")
                .description("Statements executed")
                .register(registry);
        this.selects = Counter.builder(namePrefix + ".selects")
                .description("Queries materialized")
                .register(registry);
        this.failures = Counter.builder(namePrefix + ".failures")
                .description("Operations failed with a driver error")
                .register(registry);
        this.transactionsBegun = Counter.builder(namePrefix + ".transactions.begun")
                .description("Transactions begun")
                .register(registry);
        this.transactionsCommitted = Counter.builder(namePrefix + ".transactions.committed")
                .description("Transactions committed")
                .register(registry);
        this.transactionsRolledBack = Counter.builder(namePrefix + ".transactions.rolledback")
                .description("Transactions rolled back on request")
                .register(registry);
        this.transactionsEvicted = Counter.builder(namePrefix + ".transactions.evicted")
                .description("Idle transactions rolled back by the reaper")
                .register(registry);

        this.activeTransactionsGauge = Gauge.builder(namePrefix + ".transactions.active",
                        activeTransactions, AtomicInteger::get)
                .description("Transactions currently registered")
                .register(registry);
    }

    @Override
    public void incrementConnects() {
        if (closed) return;
        connects.increment();
    }

    @Override
    public void incrementStatements() {
        if (closed) return;
        statements.increment();
    }

    @Override
    public void incrementSelects() {
        if (closed) return;
        selects.increment();
    }

    @Override
    public void incrementFailures() {
        if (closed) return;
        failures.increment();
    }

    @Override
    public void incrementTransactionsBegun() {
        if (closed) return;
        transactionsBegun.increment();
    }

    @Override
    public void incrementTransactionsCommitted() {
        if (closed) return;
        transactionsCommitted.increment();
    }

    @Override
    public void incrementTransactionsRolledBack() {
        if (closed) return;
        transactionsRolledBack.increment();
    }

    @Override
    public void incrementTransactionsEvicted() {
        if (closed) return;
        transactionsEvicted.increment();
    }

    @Override
    public void recordActiveTransactions(int count) {
        if (closed) return;
        activeTransactions.set(count);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Called by {@link io.sqltx.SqlGateway#close()} when the exporter is the gateway's
     * metrics exporter, so stale gauges do not outlive the gateway.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(connects, statements, selects, failures,
                transactionsBegun, transactionsCommitted, transactionsRolledBack, transactionsEvicted,
                activeTransactionsGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
