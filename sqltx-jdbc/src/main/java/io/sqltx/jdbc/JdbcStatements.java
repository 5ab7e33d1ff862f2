package io.sqltx.jdbc;

import io.sqltx.DriverException;
import io.sqltx.ExecuteResult;
import io.sqltx.jdbc.backend.AbstractJdbcBackend;
import io.sqltx.jdbc.codec.PositionalSql;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JDBC helper shared by pooled and transactional statement execution.
 */
public final class JdbcStatements {

    /**
     * Execute a statement, return rows affected and the backend's last insert id. A statement
     * that produces a result set affects 0 rows.
     */
    public static ExecuteResult execute(Connection conn, AbstractJdbcBackend backend, String sql, List<?> values) {
        try {
            PositionalSql statement = backend.parameterize(sql, values);
            try (PreparedStatement ps = backend.prepareUpdate(conn, statement.sql())) {
                backend.binder().bind(ps, statement.values());
                boolean hasResultSet = ps.execute();
                long rowsAffected = hasResultSet ? 0 : Math.max(0, ps.getUpdateCount());
                return new ExecuteResult(rowsAffected, backend.lastInsertId(conn, ps));
            }
        } catch (SQLException e) {
            throw new DriverException("Failed to execute statement", e);
        }
    }

    /**
     * Execute a query, decode every row. A statement that produces no result set returns no
     * rows.
     */
    public static List<Map<String, Object>> select(Connection conn, AbstractJdbcBackend backend, String sql,
            List<?> values) {
        try {
            PositionalSql statement = backend.parameterize(sql, values);
            try (PreparedStatement ps = conn.prepareStatement(statement.sql())) {
                backend.binder().bind(ps, statement.values());
                if (!ps.execute()) {
                    return List.of();
                }
                try (ResultSet rs = ps.getResultSet()) {
                    return backend.decoder().decodeAll(rs);
                }
            }
        } catch (SQLException e) {
            throw new DriverException("Failed to execute query", e);
        }
    }

    private JdbcStatements() {}
}
