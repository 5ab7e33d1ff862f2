package io.sqltx;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Asynchronous view of a {@link SqlGateway}: every operation is submitted to an executor and
 * completes a {@link CompletableFuture}, so callers are not blocked while a statement is in
 * flight.
 *
 * <p>Failures complete the future exceptionally with the same {@link SqlGatewayException} the
 * blocking call would throw (wrapped in a {@link java.util.concurrent.CompletionException} when
 * observed through {@code join()}). Statements of one transaction still run one at a time;
 * callers that need a particular order within a transaction must chain the futures.
 *
 * <p>Obtain instances via {@link SqlGateway#async(Executor)}. Closing the gateway is left to
 * its owner.
 */
public final class AsyncSqlGateway {
    private final SqlGateway gateway;
    private final Executor executor;

    AsyncSqlGateway(SqlGateway gateway, Executor executor) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public CompletableFuture<String> ping(String value) {
        return CompletableFuture.completedFuture(gateway.ping(value));
    }

    public CompletableFuture<String> connect(String url) {
        return CompletableFuture.supplyAsync(() -> gateway.connect(url), executor);
    }

    public CompletableFuture<ExecuteResult> execute(String db, String query) {
        return execute(db, query, List.of());
    }

    public CompletableFuture<ExecuteResult> execute(String db, String query, List<?> values) {
        return CompletableFuture.supplyAsync(() -> gateway.execute(db, query, values), executor);
    }

    public CompletableFuture<List<Map<String, Object>>> select(String db, String query) {
        return select(db, query, List.of());
    }

    public CompletableFuture<List<Map<String, Object>>> select(String db, String query, List<?> values) {
        return CompletableFuture.supplyAsync(() -> gateway.select(db, query, values), executor);
    }

    public CompletableFuture<String> beginTransaction(String db) {
        return CompletableFuture.supplyAsync(() -> gateway.beginTransaction(db), executor);
    }

    public CompletableFuture<ExecuteResult> executeInTransaction(String txId, String query) {
        return executeInTransaction(txId, query, List.of());
    }

    public CompletableFuture<ExecuteResult> executeInTransaction(String txId, String query, List<?> values) {
        return CompletableFuture.supplyAsync(() -> gateway.executeInTransaction(txId, query, values), executor);
    }

    public CompletableFuture<Void> commit(String txId) {
        return CompletableFuture.runAsync(() -> gateway.commit(txId), executor);
    }

    public CompletableFuture<Void> rollback(String txId) {
        return CompletableFuture.runAsync(() -> gateway.rollback(txId), executor);
    }
}
