package io.sqltx.pool;

import io.sqltx.ConfigurationException;
import io.sqltx.ConnectionUrl;
import io.sqltx.DatabaseKind;
import io.sqltx.DatabaseNotFoundException;
import io.sqltx.spi.Backend;
import io.sqltx.spi.DatabasePool;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the mapping from connection identifier (the caller's URL, verbatim) to an open pool.
 *
 * <p>Connecting takes the write lock only to insert the freshly opened pool; lookups take the
 * read lock and statements run outside of it, so any number of queries against the same or
 * different pools proceed concurrently.
 *
 * <p>Reconnecting with an identifier that is already registered replaces the entry. The
 * replaced pool is neither drained nor closed, so statements already running on it complete
 * normally; it is released when the registry is {@linkplain #close() closed}.
 */
public final class PoolRegistry implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(PoolRegistry.class.getName());

    private final Map<DatabaseKind, Backend> backends;
    private final Path dataDirectory;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, DatabasePool> pools = new HashMap<>();
    private final List<DatabasePool> replaced = new ArrayList<>();
    private boolean closed;

    /**
     * @param backends      available backends, at most one per {@link DatabaseKind}
     * @param dataDirectory base directory for relative file-backed database paths
     * @throws IllegalArgumentException if two backends serve the same kind
     */
    public PoolRegistry(Collection<? extends Backend> backends, Path dataDirectory) {
        Objects.requireNonNull(backends, "backends");
        this.dataDirectory = Objects.requireNonNull(dataDirectory, "dataDirectory");
        Map<DatabaseKind, Backend> byKind = new EnumMap<>(DatabaseKind.class);
        for (Backend backend : backends) {
            Backend previous = byKind.put(backend.kind(), backend);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate backend for " + backend.kind());
            }
        }
        this.backends = byKind;
    }

    /**
     * Opens a pool for {@code url} and registers it under the URL itself.
     *
     * @param url the connection URL
     * @return the connection identifier, equal to {@code url}
     * @throws ConfigurationException         if the URL is malformed or its backend is unavailable
     * @throws io.sqltx.DriverException if the pool cannot be opened
     */
    public String connect(String url) {
        ConnectionUrl parsed = ConnectionUrl.parse(url);
        Backend backend = backends.get(parsed.kind());
        if (backend == null) {
            throw new ConfigurationException("No backend registered for " + parsed.kind()
                    + ". Available: " + backends.keySet());
        }

        DatabasePool pool = backend.open(parsed, dataDirectory);

        lock.writeLock().lock();
        try {
            if (closed) {
                pool.close();
                throw new IllegalStateException("PoolRegistry has been closed");
            }
            DatabasePool previous = pools.put(url, pool);
            if (previous != null) {
                replaced.add(previous);
                logger.log(Level.WARNING, "Replaced existing pool for {0}", url);
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.log(Level.FINE, "Connected {0} pool for {1}", new Object[]{parsed.kind(), url});
        return url;
    }

    /**
     * Resolves a connection identifier.
     *
     * @throws DatabaseNotFoundException if nothing is registered under {@code database}
     */
    public DatabasePool get(String database) {
        lock.readLock().lock();
        try {
            DatabasePool pool = pools.get(database);
            if (pool == null) {
                throw new DatabaseNotFoundException(String.valueOf(database));
            }
            return pool;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the identifiers currently registered, sorted.
     */
    public Set<String> identifiers() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(pools.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Closes every registered and replaced pool. Further {@link #connect} calls fail.
     */
    @Override
    public void close() {
        List<DatabasePool> toClose;
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(pools.values());
            toClose.addAll(replaced);
            pools.clear();
            replaced.clear();
        } finally {
            lock.writeLock().unlock();
        }

        RuntimeException first = null;
        for (DatabasePool pool : toClose) {
            try {
                pool.close();
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) {
            throw first;
        }
    }
}
