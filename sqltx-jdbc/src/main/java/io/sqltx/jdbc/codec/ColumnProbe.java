package io.sqltx.jdbc.codec;

import java.sql.ResultSet;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.util.Set;

/**
 * One attempt to read a non-null column value as a particular type.
 *
 * <p>A probe that cannot read the column throws {@link SQLDataException}; the
 * {@link RowDecoder} then moves on to its next probe.
 */
@FunctionalInterface
public interface ColumnProbe {

    /**
     * @param rs     result set positioned on the current row
     * @param column the column being decoded
     * @param raw    the driver's {@code getObject} value, never {@code null}
     * @return the decoded value
     */
    Object read(ResultSet rs, ColumnMeta column, Object raw) throws SQLException;

    /**
     * Restricts {@code reader} to columns whose JDBC type is in {@code jdbcTypes}.
     *
     * @param target name of the attempted type, used in the failure message
     */
    static ColumnProbe forTypes(String target, Set<Integer> jdbcTypes, ColumnProbe reader) {
        return (rs, column, raw) -> {
            if (!jdbcTypes.contains(column.jdbcType())) {
                throw mismatch(column, target);
            }
            return reader.read(rs, column, raw);
        };
    }

    static SQLDataException mismatch(ColumnMeta column, String target) {
        return new SQLDataException("column " + column.label() + " of type " + column.typeName()
                + " is not compatible with " + target);
    }
}
