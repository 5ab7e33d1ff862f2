package io.sqltx.jdbc.backend;

import io.sqltx.ConfigurationException;
import io.sqltx.ConnectionUrl;
import io.sqltx.DatabaseKind;
import io.sqltx.ExecuteResult;
import io.sqltx.spi.DatabasePool;
import io.sqltx.spi.DatabaseTransaction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteBackendTest {

    @TempDir
    Path tempDir;

    private final SqliteBackend backend = new SqliteBackend("test");

    @Test
    void relativePathResolvesAgainstCreatedDataDirectory() {
        Path dataDirectory = tempDir.resolve("nested").resolve("data");

        try (DatabasePool pool = backend.open(ConnectionUrl.parse("sqlite:app.db"), dataDirectory)) {
            pool.execute("CREATE TABLE t(x TEXT)", List.of());
        }

        assertTrue(Files.isRegularFile(dataDirectory.resolve("app.db")));
    }

    @Test
    void absolutePathIsKept() {
        Path file = tempDir.resolve("abs").resolve("direct.db");

        try (DatabasePool pool = backend.open(ConnectionUrl.parse("sqlite:" + file), tempDir.resolve("unused"))) {
            pool.execute("CREATE TABLE t(x TEXT)", List.of());
        }

        assertTrue(Files.isRegularFile(file));
    }

    @Test
    void queryParametersAreNotPartOfFileName() {
        Path file = SqliteBackend.databaseFile(ConnectionUrl.parse("sqlite:app.db?mode=rwc"), tempDir);
        assertEquals(tempDir.resolve("app.db"), file);
    }

    @Test
    void fileDatabaseOutlivesPool() {
        ConnectionUrl url = ConnectionUrl.parse("sqlite:persist.db");
        try (DatabasePool pool = backend.open(url, tempDir)) {
            pool.execute("CREATE TABLE t(id INTEGER PRIMARY KEY, name TEXT)", List.of());
            pool.execute("INSERT INTO t(name) VALUES (?)", List.of("kept"));
        }

        try (DatabasePool pool = backend.open(url, tempDir)) {
            assertEquals(List.of(Map.of("id", 1L, "name", "kept")), pool.select("SELECT * FROM t", List.of()));
        }
    }

    @Test
    void uncreatableDataDirectoryIsConfigurationError() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> backend.open(ConnectionUrl.parse("sqlite:app.db"), blocker.resolve("sub")));
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void memoryDatabasesArePrivatePerPool() {
        ConnectionUrl url = ConnectionUrl.parse("sqlite::memory:");
        try (DatabasePool first = backend.open(url, tempDir);
             DatabasePool second = backend.open(url, tempDir)) {
            first.execute("CREATE TABLE only_first(x TEXT)", List.of());

            assertEquals(List.of(), first.select("SELECT x FROM only_first", List.of()));
            assertEquals(List.of(), second.select(
                    "SELECT name FROM sqlite_master WHERE name = 'only_first'", List.of()));
        }
        assertTrue(Files.notExists(tempDir.resolve(":memory:")));
    }

    @Test
    void transactionSeesItsOwnWrites() {
        try (DatabasePool pool = backend.open(ConnectionUrl.parse("sqlite::memory:"), tempDir)) {
            pool.execute("CREATE TABLE t(id INTEGER PRIMARY KEY, name TEXT)", List.of());
            DatabaseTransaction tx = pool.begin();

            ExecuteResult insert = tx.execute("INSERT INTO t(name) VALUES (?)", List.of("a"));
            ExecuteResult update = tx.execute("UPDATE t SET name = ? WHERE id = ?", List.of("b", 1));
            tx.commit();

            assertEquals(new ExecuteResult(1, "1"), insert);
            assertEquals(1, update.rowsAffected());
            assertEquals("b", pool.select("SELECT name FROM t", List.of()).get(0).get("name"));
            assertThrows(IllegalStateException.class, () -> tx.execute("SELECT 1", List.of()));
        }
    }

    @Test
    void rejectsUrlOfOtherKind() {
        assertThrows(IllegalArgumentException.class,
                () -> backend.open(ConnectionUrl.parse("mysql://h/db"), tempDir));
    }

    @Test
    void identity() {
        assertEquals(DatabaseKind.SQLITE, backend.kind());
        assertEquals("sqlite", backend.name());
    }
}
