package io.sqltx;

/**
 * Thrown when a connection URL is malformed or names an unsupported backend, or when local
 * resources for a file-backed database cannot be prepared. Raised before any database I/O.
 */
public final class ConfigurationException extends SqlGatewayException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFIGURATION;
    }
}
