package io.sqltx.jdbc.codec;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Locale;

/**
 * SQLite decoding is driven by each value's storage class, since a column may hold values of
 * any type regardless of its declaration. The declared type matters only for booleans: an
 * integer stored in a column declared {@code BOOLEAN} decodes as {@link Boolean}.
 *
 * <p>Probe order: 64-bit integer, float, text, boolean. Blobs decode as {@code null}.
 */
public final class SqliteRowDecoder extends RowDecoder {

    private final List<ColumnProbe> probes = List.of(
            SqliteRowDecoder::int64,
            SqliteRowDecoder::float64,
            SqliteRowDecoder::text,
            SqliteRowDecoder::bool);

    @Override
    protected List<ColumnProbe> probes() {
        return probes;
    }

    private static Object int64(ResultSet rs, ColumnMeta column, Object raw) throws SQLException {
        if (!isIntegerStorage(raw) || declaredBoolean(column)) {
            throw ColumnProbe.mismatch(column, "int64");
        }
        return ((Number) raw).longValue();
    }

    private static Object float64(ResultSet rs, ColumnMeta column, Object raw) throws SQLException {
        if (!(raw instanceof Double || raw instanceof Float)) {
            throw ColumnProbe.mismatch(column, "float64");
        }
        return finite(((Number) raw).doubleValue());
    }

    private static Object text(ResultSet rs, ColumnMeta column, Object raw) throws SQLException {
        if (!(raw instanceof String)) {
            throw ColumnProbe.mismatch(column, "text");
        }
        return raw;
    }

    private static Object bool(ResultSet rs, ColumnMeta column, Object raw) throws SQLException {
        if (raw instanceof Boolean) {
            return raw;
        }
        if (!isIntegerStorage(raw) || !declaredBoolean(column)) {
            throw ColumnProbe.mismatch(column, "boolean");
        }
        return ((Number) raw).longValue() != 0;
    }

    private static boolean isIntegerStorage(Object raw) {
        return raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte;
    }

    private static boolean declaredBoolean(ColumnMeta column) {
        if (column.jdbcType() == Types.BOOLEAN) {
            return true;
        }
        String typeName = column.typeName();
        return typeName != null && typeName.toUpperCase(Locale.ROOT).contains("BOOL");
    }
}
