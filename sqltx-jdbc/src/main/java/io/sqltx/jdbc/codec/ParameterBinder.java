package io.sqltx.jdbc.codec;

import io.sqltx.util.JsonCodec;
import io.sqltx.value.ValueKind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Objects;

/**
 * Binds dynamic values to positional statement parameters according to their
 * {@link ValueKind}.
 *
 * <p>The same rules apply to every backend: null as a text-typed SQL NULL, text as a string,
 * integer-valued numbers as a 64-bit integer, other numbers as a 64-bit float, booleans as a
 * boolean, and everything else as its JSON text.
 */
public final class ParameterBinder {
    private final JsonCodec jsonCodec;

    public ParameterBinder() {
        this(JsonCodec.getDefault());
    }

    public ParameterBinder(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    /**
     * Binds {@code values} to parameters {@code 1..values.size()}.
     */
    public void bind(PreparedStatement ps, List<?> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            bindValue(ps, i + 1, values.get(i));
        }
    }

    void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
        switch (ValueKind.of(value)) {
            case NULL -> ps.setNull(index, Types.VARCHAR);
            case TEXT -> ps.setString(index, value.toString());
            case INTEGER -> ps.setLong(index, ValueKind.toLong((Number) value));
            case FLOAT -> ps.setDouble(index, ((Number) value).doubleValue());
            case BOOLEAN -> ps.setBoolean(index, (Boolean) value);
            case OTHER -> ps.setString(index, jsonCodec.toJson(value));
        }
    }
}
