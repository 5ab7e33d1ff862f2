package io.sqltx;

/**
 * Unchecked exception wrapping failures reported by the underlying database driver: syntax
 * errors, constraint violations, lost connectivity, commit or rollback failures.
 *
 * <p>The driver's message is kept in the message of this exception and the original
 * exception is preserved as the cause.
 */
public final class DriverException extends SqlGatewayException {
    public DriverException(String message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DRIVER;
    }
}
