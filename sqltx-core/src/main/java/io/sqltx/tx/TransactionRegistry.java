package io.sqltx.tx;

import io.sqltx.ExecuteResult;
import io.sqltx.TransactionNotFoundException;
import io.sqltx.spi.DatabasePool;
import io.sqltx.spi.DatabaseTransaction;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns every active transaction, addressed by an opaque random identifier.
 *
 * <p>Lifecycle: {@link #begin} registers a handle (<em>active</em>); {@link #execute} may be
 * called any number of times; {@link #commit} or {@link #rollback} removes the handle and
 * finalizes it (<em>finished</em>). A removed identifier is never registered again, and the
 * handle is removed whether or not finalization succeeds.
 *
 * <p>Locking is per handle: the map only serializes insertion and removal, and each handle has
 * its own lock, so the statements of one transaction run strictly one after another while
 * different transactions proceed in parallel. A transaction removed while one of its
 * statements is running is finalized once that statement returns; any statement that
 * acquires the handle after finalization fails with {@link TransactionNotFoundException}.
 *
 * <p>Transactions never expire on their own. An abandoned transaction keeps its connection
 * until it is finished, reaped by a {@link TransactionReaper}, or the registry is shut down
 * with {@link #rollbackAll()}.
 */
public final class TransactionRegistry {
    private static final Logger logger = Logger.getLogger(TransactionRegistry.class.getName());

    private final ConcurrentMap<UUID, Handle> transactions = new ConcurrentHashMap<>();
    private final Clock clock;

    public TransactionRegistry() {
        this(Clock.systemUTC());
    }

    public TransactionRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens a transaction on {@code pool} and registers it under a fresh identifier.
     * Nothing is registered if opening fails.
     *
     * @return the transaction identifier
     * @throws io.sqltx.DriverException if the transaction cannot be started
     */
    public String begin(DatabasePool pool) {
        Objects.requireNonNull(pool, "pool");
        DatabaseTransaction transaction = pool.begin();
        Handle handle;
        do {
            handle = new Handle(UUID.randomUUID(), transaction, clock.instant());
        } while (transactions.putIfAbsent(handle.id, handle) != null);
        logger.log(Level.FINE, "Began {0} transaction {1}", new Object[]{transaction.kind(), handle.id});
        return handle.id.toString();
    }

    /**
     * Executes a statement inside an active transaction. The transaction stays active.
     *
     * @throws TransactionNotFoundException if {@code txId} is not an active transaction
     * @throws io.sqltx.DriverException     if the statement fails
     */
    public ExecuteResult execute(String txId, String query, List<?> values) {
        Handle handle = transactions.get(parse(txId));
        if (handle == null) {
            throw new TransactionNotFoundException(String.valueOf(txId));
        }
        handle.lock.lock();
        try {
            if (handle.finished) {
                throw new TransactionNotFoundException(txId);
            }
            handle.lastUsed = clock.instant();
            try {
                return handle.transaction.execute(query, values);
            } finally {
                handle.lastUsed = clock.instant();
            }
        } finally {
            handle.lock.unlock();
        }
    }

    /**
     * Removes and commits a transaction.
     *
     * @throws TransactionNotFoundException if {@code txId} is not an active transaction
     * @throws io.sqltx.DriverException     if the commit fails; the identifier is invalid afterwards
     */
    public void commit(String txId) {
        Handle handle = remove(txId);
        handle.lock.lock();
        try {
            handle.finished = true;
            handle.transaction.commit();
        } finally {
            handle.lock.unlock();
        }
        logger.log(Level.FINE, "Committed transaction {0}", handle.id);
    }

    /**
     * Removes and rolls back a transaction.
     *
     * @throws TransactionNotFoundException if {@code txId} is not an active transaction
     * @throws io.sqltx.DriverException     if the rollback fails; the identifier is invalid afterwards
     */
    public void rollback(String txId) {
        Handle handle = remove(txId);
        handle.lock.lock();
        try {
            handle.finished = true;
            handle.transaction.rollback();
        } finally {
            handle.lock.unlock();
        }
        logger.log(Level.FINE, "Rolled back transaction {0}", handle.id);
    }

    /**
     * Rolls back every transaction whose last statement finished (or which began) before
     * {@code cutoff}. Transactions with a statement in flight are skipped.
     *
     * @return identifiers of the transactions rolled back
     */
    public List<String> evictIdle(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff");
        List<String> evicted = new ArrayList<>();
        for (Handle handle : transactions.values()) {
            if (!handle.lastUsed.isBefore(cutoff) || !handle.lock.tryLock()) {
                continue;
            }
            try {
                if (handle.finished || !handle.lastUsed.isBefore(cutoff)
                        || !transactions.remove(handle.id, handle)) {
                    continue;
                }
                handle.finished = true;
                evicted.add(handle.id.toString());
                try {
                    handle.transaction.rollback();
                    logger.log(Level.WARNING, "Rolled back transaction {0} idle since {1}",
                            new Object[]{handle.id, handle.lastUsed});
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Forced rollback of idle transaction " + handle.id + " failed", e);
                }
            } finally {
                handle.lock.unlock();
            }
        }
        return evicted;
    }

    /**
     * Rolls back and removes every remaining transaction, waiting for in-flight statements.
     * Individual failures are logged; the remaining transactions are still rolled back.
     *
     * @return the number of transactions rolled back
     */
    public int rollbackAll() {
        int count = 0;
        for (UUID id : new ArrayList<>(transactions.keySet())) {
            Handle handle = transactions.remove(id);
            if (handle == null) {
                continue;
            }
            handle.lock.lock();
            try {
                handle.finished = true;
                handle.transaction.rollback();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Rollback of transaction " + id + " during shutdown failed", e);
            } finally {
                handle.lock.unlock();
            }
            count++;
        }
        return count;
    }

    /**
     * Returns the number of active transactions.
     */
    public int size() {
        return transactions.size();
    }

    private Handle remove(String txId) {
        Handle handle = transactions.remove(parse(txId));
        if (handle == null) {
            throw new TransactionNotFoundException(String.valueOf(txId));
        }
        return handle;
    }

    private static UUID parse(String txId) {
        if (txId == null) {
            throw new TransactionNotFoundException("null");
        }
        try {
            return UUID.fromString(txId);
        } catch (IllegalArgumentException e) {
            throw new TransactionNotFoundException(txId);
        }
    }

    private static final class Handle {
        private final UUID id;
        private final DatabaseTransaction transaction;
        private final ReentrantLock lock = new ReentrantLock();
        private volatile Instant lastUsed;
        // guarded by lock
        private boolean finished;

        private Handle(UUID id, DatabaseTransaction transaction, Instant createdAt) {
            this.id = id;
            this.transaction = transaction;
            this.lastUsed = createdAt;
        }
    }
}
