package com.eavstore.core.store;

import com.eavstore.core.config.EavStoreConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

class EavDatabaseTest {

    @TempDir
    Path tempDir;

    private EavDatabase db;

    @BeforeEach
    void setUp() throws SQLException {
        db = new EavDatabase(EavStoreConfig.forPath(tempDir.resolve("nested").resolve("db.sqlite")));
        db.executeInTransaction(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("CREATE TABLE t (v INTEGER)");
            }
        });
    }

    private int count() throws SQLException {
        return db.executeRead(EavDatabaseTest::count);
    }

    private static int count(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM t")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private static void insert(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("INSERT INTO t (v) VALUES (1)");
        }
    }

    @Test
    @DisplayName("Creates the parent directory of the database file")
    void createsParentDirectory() {
        assertTrue(db.exists());
        assertTrue(Files.isDirectory(tempDir.resolve("nested")));
    }

    @Test
    @DisplayName("Connections use the configured pragmas")
    void pragmas() throws SQLException {
        String journal = db.executeRead(conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("PRAGMA journal_mode")) {
                rs.next();
                return rs.getString(1);
            }
        });
        int foreignKeys = db.executeRead(conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("PRAGMA foreign_keys")) {
                rs.next();
                return rs.getInt(1);
            }
        });

        assertEquals("wal", journal.toLowerCase());
        assertEquals(1, foreignKeys);
    }

    @Test
    @DisplayName("Successful transactions commit")
    void commits() throws SQLException {
        db.executeInTransaction(EavDatabaseTest::insert);

        assertEquals(1, count());
    }

    @Test
    @DisplayName("A failing transaction rolls back and rethrows")
    void rollsBackOnFailure() throws SQLException {
        EavDatabase.TransactionConsumer failing = conn -> {
            insert(conn);
            throw new IllegalStateException("boom");
        };

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> db.executeInTransaction(failing));

        assertEquals("boom", e.getMessage());
        assertEquals(0, count());
    }

    @Test
    @DisplayName("executeAndRollback never keeps writes")
    void executeAndRollback() throws SQLException {
        String result = db.executeAndRollback(conn -> {
            insert(conn);
            return "done";
        });

        assertEquals("done", result);
        assertEquals(0, count());
    }

    @Test
    @DisplayName("executeAndRollback reads while another connection holds the write lock")
    void executeAndRollbackDoesNotWaitForWriter() throws SQLException {
        // No busy timeout: waiting for the write lock would fail straight away
        EavDatabase impatient = new EavDatabase(new EavStoreConfig(db.getConfig().getDatabasePath(), 0, "WAL"));

        try (Connection writer = db.openConnection()) {
            writer.setAutoCommit(false);
            insert(writer);

            int seen = impatient.executeAndRollback(EavDatabaseTest::count);

            assertEquals(0, seen);
            writer.rollback();
        }
    }
}
