package io.sqltx;

/**
 * Coarse classification of gateway failures, stable across backends.
 *
 * @see SqlGatewayException#kind()
 */
public enum ErrorKind {
    /** Unknown or malformed connection URL, or local resources could not be prepared. */
    CONFIGURATION,
    /** The connection or transaction identifier has no live entry. */
    NOT_FOUND,
    /** Failure reported by the database engine or its driver. */
    DRIVER
}
