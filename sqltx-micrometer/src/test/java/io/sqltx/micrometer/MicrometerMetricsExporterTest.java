package io.sqltx.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MicrometerMetricsExporterTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MicrometerMetricsExporter(registry);
    }

    @Test
    void incrementConnects() {
        exporter.incrementConnects();
        exporter.incrementConnects();
        assertEquals(2.0, counter("sqltx.connects").count());
    }

    @Test
    void statementAndSelectCountersAreSeparate() {
        exporter.incrementStatements();
        exporter.incrementStatements();
        exporter.incrementSelects();
        assertEquals(2.0, counter("sqltx.statements").count());
        assertEquals(1.0, counter("sqltx.selects").count());
    }

    @Test
    void incrementFailures() {
        exporter.incrementFailures();
        assertEquals(1.0, counter("sqltx.failures").count());
    }

    @Test
    void transactionLifecycleCounters() {
        exporter.incrementTransactionsBegun();
        exporter.incrementTransactionsBegun();
        exporter.incrementTransactionsBegun();
        exporter.incrementTransactionsCommitted();
        exporter.incrementTransactionsRolledBack();
        exporter.incrementTransactionsEvicted();

        assertEquals(3.0, counter("sqltx.transactions.begun").count());
        assertEquals(1.0, counter("sqltx.transactions.committed").count());
        assertEquals(1.0, counter("sqltx.transactions.rolledback").count());
        assertEquals(1.0, counter("sqltx.transactions.evicted").count());
    }

    @Test
    void recordActiveTransactions() {
        exporter.recordActiveTransactions(4);
        assertEquals(4.0, gauge("sqltx.transactions.active").value());

        exporter.recordActiveTransactions(0);
        assertEquals(0.0, gauge("sqltx.transactions.active").value());
    }

    @Test
    void customNamePrefix() {
        var custom = new MicrometerMetricsExporter(registry, "reports.sqltx");
        custom.incrementConnects();
        custom.recordActiveTransactions(2);

        assertEquals(1.0, counter("reports.sqltx.connects").count());
        assertEquals(2.0, gauge("reports.sqltx.transactions.active").value());
        assertEquals(0.0, counter("sqltx.connects").count());
    }

    @Test
    void closeRemovesMetersAndIgnoresLaterUpdates() {
        exporter.incrementStatements();
        exporter.close();

        assertNull(registry.find("sqltx.statements").counter());
        assertNull(registry.find("sqltx.transactions.active").gauge());

        exporter.incrementStatements();
        exporter.recordActiveTransactions(9);
        assertNull(registry.find("sqltx.statements").counter());
    }

    @Test
    void nullRegistryThrows() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    }

    @Test
    void invalidPrefixThrows() {
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "sqltx."));
    }

    private Counter counter(String name) {
        Counter c = registry.find(name).counter();
        assertNotNull(c, "Counter not found: " + name);
        return c;
    }

    private Gauge gauge(String name) {
        Gauge g = registry.find(name).gauge();
        assertNotNull(g, "Gauge not found: " + name);
        return g;
    }
}
