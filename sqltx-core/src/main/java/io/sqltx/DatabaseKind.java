package io.sqltx;

import java.util.List;
import java.util.Optional;

/**
 * The closed set of database backends the gateway can reach. Every pool and every
 * transaction is tagged with exactly one kind.
 */
public enum DatabaseKind {
    SQLITE(List.of("sqlite")),
    MYSQL(List.of("mysql")),
    POSTGRES(List.of("postgres", "postgresql"));

    private final List<String> schemes;

    DatabaseKind(List<String> schemes) {
        this.schemes = schemes;
    }

    /**
     * URL schemes (the text before the first {@code ':'}) that select this kind.
     */
    public List<String> schemes() {
        return schemes;
    }

    /**
     * Looks up the kind for a URL scheme. Matching is exact and case-sensitive.
     *
     * @param scheme the scheme without the trailing colon
     * @return the matching kind, or empty if the scheme is not supported
     */
    public static Optional<DatabaseKind> forScheme(String scheme) {
        for (DatabaseKind kind : values()) {
            if (kind.schemes.contains(scheme)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
