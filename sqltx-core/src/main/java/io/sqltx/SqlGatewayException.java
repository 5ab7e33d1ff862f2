package io.sqltx;

/**
 * Base class of all failures raised by {@link SqlGateway} operations.
 *
 * <p>Every failure is terminal for the single operation that raised it; no partial results
 * are returned and nothing is retried. The message is meant to be forwarded verbatim to the
 * caller of the outer transport.
 */
public abstract class SqlGatewayException extends RuntimeException {

    protected SqlGatewayException(String message) {
        super(message);
    }

    protected SqlGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the classification of this failure.
     */
    public abstract ErrorKind kind();
}
