package io.sqltx.jdbc.codec;

/**
 * Result-set column metadata, read once per query.
 *
 * @param index    1-based column index
 * @param label    column label as reported by the driver; the key in decoded rows
 * @param jdbcType {@link java.sql.Types} constant
 * @param typeName database-specific type name (declared type for SQLite)
 */
public record ColumnMeta(int index, String label, int jdbcType, String typeName) {
}
