package io.sqltx;

import java.util.Objects;

/**
 * Thrown when a connection identifier was never connected.
 */
public final class DatabaseNotFoundException extends SqlGatewayException {
    private final String database;

    public DatabaseNotFoundException(String database) {
        super("database is not loaded: " + database);
        this.database = Objects.requireNonNull(database, "database");
    }

    /** The identifier that could not be resolved. */
    public String database() {
        return database;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
