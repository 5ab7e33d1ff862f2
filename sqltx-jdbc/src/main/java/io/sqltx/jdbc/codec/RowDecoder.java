package io.sqltx.jdbc.codec;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Materializes result-set rows as insertion-ordered maps of dynamic values.
 *
 * <p>Each non-null column is offered to the backend's probes in order; the first probe that
 * succeeds supplies the value. A column no probe can read decodes as {@code null}, as does
 * any column whose value the database reports as NULL. Decoded values are always
 * {@code null}, {@link Long}, {@link Double}, {@link String} or {@link Boolean}.
 *
 * <p>When a query returns two columns with the same label, the later column wins.
 */
public abstract class RowDecoder {
    private static final Logger logger = Logger.getLogger(RowDecoder.class.getName());

    /**
     * Probes in the order they are attempted.
     */
    protected abstract List<ColumnProbe> probes();

    /**
     * Reads every remaining row of {@code rs}.
     */
    public List<Map<String, Object>> decodeAll(ResultSet rs) throws SQLException {
        List<ColumnMeta> columns = columns(rs.getMetaData());
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (ColumnMeta column : columns) {
                row.put(column.label(), decode(rs, column));
            }
            rows.add(row);
        }
        return rows;
    }

    Object decode(ResultSet rs, ColumnMeta column) throws SQLException {
        Object raw = rs.getObject(column.index());
        if (raw == null) {
            return null;
        }
        for (ColumnProbe probe : probes()) {
            try {
                return probe.read(rs, column, raw);
            } catch (SQLException e) {
                logger.log(Level.FINEST, "Probe failed for column {0}: {1}",
                        new Object[]{column.label(), e.getMessage()});
            }
        }
        return null;
    }

    /**
     * Boxes a float, mapping NaN and infinities to {@code null}.
     */
    protected static Double finite(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    }

    private static List<ColumnMeta> columns(ResultSetMetaData meta) throws SQLException {
        int count = meta.getColumnCount();
        List<ColumnMeta> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(new ColumnMeta(i, meta.getColumnLabel(i), meta.getColumnType(i), meta.getColumnTypeName(i)));
        }
        return columns;
    }
}
