package io.sqltx.jdbc.codec;

import java.util.List;
import java.util.Objects;

/**
 * Statement text using JDBC {@code ?} placeholders, with its values in placeholder order.
 */
public record PositionalSql(String sql, List<?> values) {

    public PositionalSql {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(values, "values");
    }
}
