package io.sqltx.tx;

import io.sqltx.ConnectionUrl;
import io.sqltx.DatabaseKind;
import io.sqltx.DriverException;
import io.sqltx.ExecuteResult;
import io.sqltx.MutableClock;
import io.sqltx.StubBackend;
import io.sqltx.StubBackend.StubPool;
import io.sqltx.StubBackend.StubTransaction;
import io.sqltx.TransactionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransactionRegistryTest {

    private MutableClock clock;
    private TransactionRegistry registry;
    private StubPool pool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        registry = new TransactionRegistry(clock);
        pool = (StubPool) new StubBackend(DatabaseKind.SQLITE)
                .open(ConnectionUrl.parse("sqlite::memory:"), Path.of("."));
    }

    @Test
    void beginReturnsUniqueUuidText() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            String id = registry.begin(pool);
            UUID.fromString(id);
            ids.add(id);
        }
        assertEquals(100, ids.size());
        assertEquals(100, registry.size());
    }

    @Test
    void executeKeepsTransactionActive() {
        String txId = registry.begin(pool);

        ExecuteResult result = registry.execute(txId, "UPDATE t SET x = 1", List.of());
        registry.execute(txId, "UPDATE t SET x = 2", List.of());

        assertEquals(1, result.rowsAffected());
        assertEquals(1, registry.size());
        assertEquals(List.of("UPDATE t SET x = 1", "UPDATE t SET x = 2"),
                pool.transactions().get(0).statements());
    }

    @Test
    void commitFinishesTransaction() {
        String txId = registry.begin(pool);
        registry.commit(txId);

        StubTransaction tx = pool.transactions().get(0);
        assertEquals(1, tx.commits());
        assertEquals(0, registry.size());
        assertThrows(TransactionNotFoundException.class, () -> registry.execute(txId, "SELECT 1", List.of()));
        assertThrows(TransactionNotFoundException.class, () -> registry.commit(txId));
        assertThrows(TransactionNotFoundException.class, () -> registry.rollback(txId));
        assertEquals(1, tx.commits());
        assertEquals(0, tx.rollbacks());
    }

    @Test
    void rollbackFinishesTransaction() {
        String txId = registry.begin(pool);
        registry.rollback(txId);

        assertEquals(1, pool.transactions().get(0).rollbacks());
        TransactionNotFoundException ex = assertThrows(TransactionNotFoundException.class,
                () -> registry.rollback(txId));
        assertEquals("transaction not found: " + txId, ex.getMessage());
        assertEquals(txId, ex.txId());
    }

    @Test
    void failedCommitStillRemovesHandle() {
        String txId = registry.begin(pool);
        pool.transactions().get(0).failCommit(
                new DriverException("Failed to commit transaction", new SQLException("deadlock")));

        assertThrows(DriverException.class, () -> registry.commit(txId));
        assertEquals(0, registry.size());
        assertThrows(TransactionNotFoundException.class, () -> registry.commit(txId));
    }

    @Test
    void malformedAndUnknownIdsAreNotFound() {
        assertThrows(TransactionNotFoundException.class, () -> registry.execute("nope", "SELECT 1", List.of()));
        assertThrows(TransactionNotFoundException.class, () -> registry.commit(null));
        assertThrows(TransactionNotFoundException.class,
                () -> registry.rollback(UUID.randomUUID().toString()));
    }

    @Test
    void failedBeginRegistersNothing() {
        pool.failBegin(new DriverException("Failed to begin transaction", new SQLException("pool exhausted")));

        assertThrows(DriverException.class, () -> registry.begin(pool));
        assertEquals(0, registry.size());
    }

    @Test
    void statementsOfOneTransactionNeverOverlap() throws Exception {
        String txId = registry.begin(pool);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        pool.transactions().get(0).answerWith(q -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return new ExecuteResult(1, null);
        });

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<ExecuteResult>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(executor.submit(() -> registry.execute(txId, "UPDATE t SET x = x + 1", List.of())));
            }
            for (Future<ExecuteResult> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxInFlight.get());
        assertEquals(20, pool.transactions().get(0).statements().size());
    }

    @Test
    void differentTransactionsRunInParallel() throws Exception {
        String first = registry.begin(pool);
        String second = registry.begin(pool);
        CountDownLatch bothInside = new CountDownLatch(2);
        for (StubTransaction tx : pool.transactions()) {
            tx.answerWith(q -> {
                bothInside.countDown();
                try {
                    // only completes if the other transaction's statement is running at the same time
                    if (!bothInside.await(5, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("statements were serialized");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new ExecuteResult(1, null);
            });
        }

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ExecuteResult> a = executor.submit(() -> registry.execute(first, "UPDATE a", List.of()));
            Future<ExecuteResult> b = executor.submit(() -> registry.execute(second, "UPDATE b", List.of()));
            assertEquals(1, a.get(10, TimeUnit.SECONDS).rowsAffected());
            assertEquals(1, b.get(10, TimeUnit.SECONDS).rowsAffected());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void commitWaitsForInFlightStatement() throws Exception {
        String txId = registry.begin(pool);
        StubTransaction tx = pool.transactions().get(0);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        tx.answerWith(q -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ExecuteResult(1, null);
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ExecuteResult> statement = executor.submit(() -> registry.execute(txId, "UPDATE t", List.of()));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Future<?> commit = executor.submit(() -> registry.commit(txId));

            Thread.sleep(50);
            assertEquals(0, tx.commits());

            release.countDown();
            statement.get(5, TimeUnit.SECONDS);
            commit.get(5, TimeUnit.SECONDS);
            assertEquals(1, tx.commits());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void evictIdleRollsBackOnlyStaleTransactions() {
        String stale = registry.begin(pool);
        clock.advance(Duration.ofMinutes(10));
        String fresh = registry.begin(pool);

        List<String> evicted = registry.evictIdle(clock.instant().minus(Duration.ofMinutes(5)));

        assertEquals(List.of(stale), evicted);
        assertEquals(1, pool.transactions().get(0).rollbacks());
        assertEquals(0, pool.transactions().get(1).rollbacks());
        assertThrows(TransactionNotFoundException.class, () -> registry.execute(stale, "SELECT 1", List.of()));
        registry.execute(fresh, "SELECT 1", List.of());
    }

    @Test
    void statementRefreshesIdleTimestamp() {
        String txId = registry.begin(pool);
        clock.advance(Duration.ofMinutes(10));
        registry.execute(txId, "UPDATE t", List.of());

        List<String> evicted = registry.evictIdle(clock.instant().minus(Duration.ofMinutes(5)));

        assertTrue(evicted.isEmpty());
        assertEquals(1, registry.size());
    }

    @Test
    void rollbackAllFinishesEverything() {
        String a = registry.begin(pool);
        String b = registry.begin(pool);
        assertNotEquals(a, b);

        assertEquals(2, registry.rollbackAll());

        assertEquals(0, registry.size());
        for (StubTransaction tx : pool.transactions()) {
            assertEquals(1, tx.rollbacks());
        }
    }
}
