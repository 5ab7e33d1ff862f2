package io.sqltx;

import java.util.Objects;

/**
 * A caller-supplied connection URL split into its scheme and the remainder.
 *
 * <p>The {@link #raw() raw} text is the connection identifier and is never normalized:
 * {@code sqlite:a.db} and {@code sqlite:./a.db} are two different identifiers.
 *
 * @param raw  the URL exactly as supplied
 * @param kind the backend selected by the scheme
 * @param body everything after the first {@code ':'}
 */
public record ConnectionUrl(String raw, DatabaseKind kind, String body) {

    public ConnectionUrl {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(body, "body");
    }

    /**
     * Parses the scheme prefix of a connection URL.
     *
     * @param url the connection URL
     * @return the parsed URL
     * @throws ConfigurationException if the URL has no {@code ':'} or its scheme is not supported
     */
    public static ConnectionUrl parse(String url) {
        if (url == null) {
            throw new ConfigurationException("Invalid URL: null");
        }
        int colon = url.indexOf(':');
        if (colon < 0) {
            throw new ConfigurationException("Invalid URL: " + url);
        }
        String scheme = url.substring(0, colon);
        DatabaseKind kind = DatabaseKind.forScheme(scheme)
                .orElseThrow(() -> new ConfigurationException("Unsupported database type: " + scheme));
        return new ConnectionUrl(url, kind, url.substring(colon + 1));
    }
}
