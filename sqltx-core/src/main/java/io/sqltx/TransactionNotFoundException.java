package io.sqltx;

import java.util.Objects;

/**
 * Thrown when a transaction identifier is malformed, was never issued, or belongs to a
 * transaction that has already been committed or rolled back.
 */
public final class TransactionNotFoundException extends SqlGatewayException {
    private final String txId;

    public TransactionNotFoundException(String txId) {
        super("transaction not found: " + txId);
        this.txId = Objects.requireNonNull(txId, "txId");
    }

    /** The identifier that could not be resolved. */
    public String txId() {
        return txId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
