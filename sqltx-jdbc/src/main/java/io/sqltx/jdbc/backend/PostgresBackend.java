package io.sqltx.jdbc.backend;

import com.zaxxer.hikari.HikariConfig;
import io.sqltx.ConnectionUrl;
import io.sqltx.DatabaseKind;
import io.sqltx.jdbc.codec.DollarPlaceholders;
import io.sqltx.jdbc.codec.ParameterBinder;
import io.sqltx.jdbc.codec.PositionalSql;
import io.sqltx.jdbc.codec.PostgresRowDecoder;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL backend on pgJDBC. Both {@code postgres://} and {@code postgresql://} URLs become
 * {@code jdbc:postgresql://host:port/db?params} with the credentials set on the pool.
 * Statements may use numbered {@code $n} placeholders as well as {@code ?}.
 *
 * <p>PostgreSQL has no connection-level last insert id; use {@code INSERT ... RETURNING} with
 * {@code select} instead.
 */
public final class PostgresBackend extends AbstractJdbcBackend {

    public PostgresBackend() {
        this(DEFAULT_POOL_NAME_PREFIX);
    }

    public PostgresBackend(String poolNamePrefix) {
        super(poolNamePrefix, new ParameterBinder(), new PostgresRowDecoder());
    }

    @Override
    public DatabaseKind kind() {
        return DatabaseKind.POSTGRES;
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    protected void configure(HikariConfig config, ConnectionUrl url, Path dataDirectory) {
        ServerUrl server = ServerUrl.translate(url, "jdbc:postgresql:");
        config.setJdbcUrl(server.jdbcUrl());
        if (server.username() != null) {
            config.setUsername(server.username());
        }
        if (server.password() != null) {
            config.setPassword(server.password());
        }
    }

    @Override
    public PositionalSql parameterize(String sql, List<?> values) throws SQLException {
        return DollarPlaceholders.rewrite(sql, values);
    }

    @Override
    public String lastInsertId(Connection conn, PreparedStatement ps) {
        return null;
    }
}
