package io.sqltx.jdbc;

import io.sqltx.ExecuteResult;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@DockerAvailable
@Testcontainers
class PostgresGatewayIntegrationTest extends AbstractGatewayIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("sqltx_test");

    @Override
    String url() {
        return "postgres://" + postgres.getUsername() + ":" + postgres.getPassword() + "@" + postgres.getHost()
                + ":" + postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT) + "/"
                + postgres.getDatabaseName();
    }

    @Override
    String createPeopleTable() {
        return "CREATE TABLE people(id BIGSERIAL PRIMARY KEY, name TEXT)";
    }

    @Override
    String createValuesTable() {
        return "CREATE TABLE vals(s TEXT, i BIGINT, f DOUBLE PRECISION, b BOOLEAN, n TEXT, j TEXT)";
    }

    @Test
    void lastInsertIdIsAbsent() {
        ExecuteResult result = gateway.execute(db, "INSERT INTO people(name) VALUES ($1)", List.of("a"));

        assertEquals(1, result.rowsAffected());
        assertNull(result.lastInsertId());
    }

    @Test
    void returningClauseThroughSelect() {
        List<Map<String, Object>> rows = gateway.select(db,
                "INSERT INTO people(name) VALUES (?) RETURNING id", List.of("b"));

        assertEquals(List.of(Map.of("id", 1L)), rows);
    }

    @Test
    void int4AndNumericColumns() {
        Map<String, Object> row = gateway.select(db,
                "SELECT 7::int4 AS small, 12.50::numeric AS exact, 'x'::varchar AS s").get(0);

        assertEquals(7L, row.get("small"));
        assertEquals("12.50", row.get("exact"));
        assertEquals("x", row.get("s"));
    }

    @Test
    void jsonbKeyOperatorWithNumberedPlaceholder() {
        gateway.execute(db, "DROP TABLE IF EXISTS docs");
        gateway.execute(db, "CREATE TABLE docs(id BIGINT, data JSONB)");
        gateway.execute(db, "INSERT INTO docs VALUES (1, '{\"k\": 1}'), (2, '{\"other\": 1}')");

        List<Map<String, Object>> rows = gateway.select(db,
                "SELECT id FROM docs WHERE data ? 'k' AND id >= $1", List.of(1));

        assertEquals(List.of(Map.of("id", 1L)), rows);
    }
}
