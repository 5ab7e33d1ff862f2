package io.sqltx.jdbc.codec;

import java.sql.Types;
import java.util.List;
import java.util.Set;

/**
 * PostgreSQL decoding is driven by the column's JDBC type.
 *
 * <p>Probe order: {@code int8}, {@code int4}/{@code int2}, float, text, boolean. Integers of
 * every width decode as {@link Long}. {@code numeric}, temporal types and driver
 * {@code OTHER} types such as {@code uuid} and {@code json} decode as their text form;
 * {@code bytea} and arrays decode as {@code null}.
 */
public final class PostgresRowDecoder extends RowDecoder {

    private static final Set<Integer> FLOAT_TYPES = Set.of(Types.REAL, Types.FLOAT, Types.DOUBLE);
    private static final Set<Integer> TEXT_TYPES = Set.of(
            Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR, Types.NCHAR, Types.NVARCHAR, Types.LONGNVARCHAR,
            Types.CLOB, Types.NUMERIC, Types.DECIMAL, Types.DATE, Types.TIME, Types.TIMESTAMP,
            Types.TIME_WITH_TIMEZONE, Types.TIMESTAMP_WITH_TIMEZONE, Types.OTHER);
    private static final Set<Integer> BOOLEAN_TYPES = Set.of(Types.BIT, Types.BOOLEAN);

    private final List<ColumnProbe> probes = List.of(
            ColumnProbe.forTypes("int8", Set.of(Types.BIGINT),
                    (rs, column, raw) -> rs.getLong(column.index())),
            ColumnProbe.forTypes("int4", Set.of(Types.INTEGER, Types.SMALLINT),
                    (rs, column, raw) -> (long) rs.getInt(column.index())),
            ColumnProbe.forTypes("float8", FLOAT_TYPES,
                    (rs, column, raw) -> finite(rs.getDouble(column.index()))),
            ColumnProbe.forTypes("text", TEXT_TYPES,
                    (rs, column, raw) -> rs.getString(column.index())),
            ColumnProbe.forTypes("bool", BOOLEAN_TYPES,
                    (rs, column, raw) -> rs.getBoolean(column.index())));

    @Override
    protected List<ColumnProbe> probes() {
        return probes;
    }
}
