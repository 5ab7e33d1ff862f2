package io.sqltx.tx;

import io.sqltx.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that rolls back transactions left idle longer than a configurable
 * timeout, releasing the connections and locks they hold.
 *
 * <p>Runs on a single daemon thread. Each cycle calls
 * {@link TransactionRegistry#evictIdle(Instant)} with {@code now - idleTimeout}; transactions
 * with a statement in flight are never touched. A reaped transaction is finished exactly as if
 * the caller had rolled it back, so its identifier becomes unknown.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see TransactionReaper.Builder
 */
public final class TransactionReaper implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(TransactionReaper.class.getName());

    private final TransactionRegistry registry;
    private final MetricsExporter metrics;
    private final Duration idleTimeout;
    private final Duration interval;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> reapTask;
    private volatile boolean closed;

    private TransactionReaper(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.idleTimeout = Objects.requireNonNull(builder.idleTimeout, "idleTimeout");
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("idleTimeout must be > 0");
        }
        if (builder.interval.isNegative() || builder.interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.interval = builder.interval;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled reap loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("TransactionReaper has been closed");
        }
        if (reapTask != null) {
            return;
        }
        AtomicInteger threads = new AtomicInteger(1);
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "sqltx-reaper-" + threads.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        reapTask = scheduler.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single reap cycle.
     *
     * <p>May be invoked directly for testing or one-off sweeps.
     *
     * @return the number of transactions rolled back
     */
    public int runOnce() {
        if (closed) {
            return 0;
        }
        try {
            Instant cutoff = clock.instant().minus(idleTimeout);
            List<String> evicted = registry.evictIdle(cutoff);
            for (int i = 0; i < evicted.size(); i++) {
                metrics.incrementTransactionsEvicted();
            }
            if (!evicted.isEmpty()) {
                metrics.recordActiveTransactions(registry.size());
                logger.log(Level.INFO, "Reaped {0} transactions idle since before {1}",
                        new Object[]{evicted.size(), cutoff});
            }
            return evicted.size();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Reap cycle failed", t);
            return 0;
        }
    }

    /** Cancels the reap schedule and shuts down the scheduler thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (reapTask != null) {
            reapTask.cancel(false);
            reapTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Builder for {@link TransactionReaper}. */
    public static final class Builder {
        private TransactionRegistry registry;
        private Duration idleTimeout;
        private Duration interval = Duration.ofSeconds(30);
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {}

        /**
         * Sets the registry whose transactions are reaped.
         *
         * <p><b>Required.</b>
         *
         * @param registry the transaction registry
         * @return this builder
         */
        public Builder registry(TransactionRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets how long a transaction may go without a statement before it is rolled back.
         *
         * <p><b>Required.</b> Must be &gt; 0.
         *
         * @param idleTimeout the idle timeout
         * @return this builder
         */
        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        /**
         * Sets the delay between reap cycles.
         *
         * <p>Optional. Defaults to {@code 30 seconds}. Must be &gt; 0.
         *
         * @param interval the reap interval
         * @return this builder
         */
        public Builder interval(Duration interval) {
            this.interval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        /**
         * Sets the metrics exporter notified of each reaped transaction.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock used to compute the idle cutoff. Must match the registry's clock.
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
         * Builds the reaper. Call {@link TransactionReaper#start()} to begin.
         *
         * @return a new {@link TransactionReaper} instance
         * @throws NullPointerException     if {@code registry} or {@code idleTimeout} is null
         * @throws IllegalArgumentException if {@code idleTimeout} or {@code interval} is not positive
         */
        public TransactionReaper build() {
            return new TransactionReaper(this);
        }
    }
}
