package io.sqltx.jdbc.codec;

import java.math.BigInteger;
import java.sql.Types;
import java.util.List;
import java.util.Set;

/**
 * MySQL decoding is driven by the column's JDBC type.
 *
 * <p>Probe order: 64-bit integer, float, text, boolean. {@code TINYINT(1)} columns are
 * reported as {@code BIT} and decode as booleans. Exact decimals, temporal values and
 * {@code BIGINT UNSIGNED} values beyond the signed range decode as their text form. Binary
 * columns decode as {@code null}.
 */
public final class MySqlRowDecoder extends RowDecoder {

    private static final Set<Integer> INTEGER_TYPES = Set.of(
            Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT);
    private static final Set<Integer> FLOAT_TYPES = Set.of(Types.REAL, Types.FLOAT, Types.DOUBLE);
    private static final Set<Integer> TEXT_TYPES = Set.of(
            Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR, Types.NCHAR, Types.NVARCHAR, Types.LONGNVARCHAR,
            Types.CLOB, Types.DECIMAL, Types.NUMERIC, Types.DATE, Types.TIME, Types.TIMESTAMP);
    private static final Set<Integer> BOOLEAN_TYPES = Set.of(Types.BIT, Types.BOOLEAN);

    private final List<ColumnProbe> probes = List.of(
            ColumnProbe.forTypes("int64", INTEGER_TYPES, (rs, column, raw) -> {
                if (raw instanceof BigInteger unsigned) {
                    if (unsigned.bitLength() >= Long.SIZE) {
                        throw ColumnProbe.mismatch(column, "int64");
                    }
                    return unsigned.longValue();
                }
                return rs.getLong(column.index());
            }),
            ColumnProbe.forTypes("float64", FLOAT_TYPES,
                    (rs, column, raw) -> finite(rs.getDouble(column.index()))),
            (rs, column, raw) -> {
                // BIGINT UNSIGNED beyond the signed range lands here as text
                if (!TEXT_TYPES.contains(column.jdbcType()) && !(raw instanceof BigInteger)) {
                    throw ColumnProbe.mismatch(column, "text");
                }
                return rs.getString(column.index());
            },
            ColumnProbe.forTypes("boolean", BOOLEAN_TYPES,
                    (rs, column, raw) -> rs.getBoolean(column.index())));

    @Override
    protected List<ColumnProbe> probes() {
        return probes;
    }
}
