package com.eavstore.core.store;

import com.eavstore.core.config.EavStoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Opens SQLite connections for the EAV store.
 *
 * Every call gets its own connection, closed before the call returns, so
 * concurrent callers are isolated by SQLite's own locking. WAL mode lets readers
 * see the last committed state while a writer is active.
 */
public class EavDatabase {

    private static final Logger log = LoggerFactory.getLogger(EavDatabase.class);

    private final EavStoreConfig config;

    public EavDatabase(EavStoreConfig config) {
        this.config = config;
    }

    public EavStoreConfig getConfig() {
        return config;
    }

    /**
     * Check if the database file exists.
     */
    public boolean exists() {
        return Files.exists(config.getDatabasePath());
    }

    /**
     * Open a new connection with the store's pragmas applied. Caller closes it.
     */
    public Connection openConnection() throws SQLException {
        // IMMEDIATE: a writer takes the write lock at BEGIN and competing writers wait out busy_timeout
        return openConnection(SQLiteConfig.TransactionMode.IMMEDIATE);
    }

    private Connection openConnection(SQLiteConfig.TransactionMode transactionMode) throws SQLException {
        Path parentDir = config.getDatabasePath().toAbsolutePath().getParent();
        if (parentDir != null && !Files.isDirectory(parentDir)) {
            try {
                Files.createDirectories(parentDir);
            } catch (IOException e) {
                throw new SQLException("Cannot create database directory " + parentDir, e);
            }
        }

        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setTransactionMode(transactionMode);
        Connection conn = DriverManager.getConnection(config.getJdbcUrl(), sqliteConfig.toProperties());
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=" + config.getJournalMode());
            stmt.execute("PRAGMA synchronous=NORMAL");
            stmt.execute("PRAGMA foreign_keys=ON");
            stmt.execute("PRAGMA busy_timeout=" + config.getBusyTimeoutMs());
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    /**
     * Execute a function within a transaction.
     * Commits on success, rolls back on any failure and rethrows it.
     */
    public <T> T executeInTransaction(TransactionFunction<T> function) throws SQLException {
        return runInTransaction(function, true);
    }

    /**
     * Execute a void function within a transaction.
     */
    public void executeInTransaction(TransactionConsumer consumer) throws SQLException {
        executeInTransaction(conn -> {
            consumer.accept(conn);
            return null;
        });
    }

    /**
     * Execute a function within a transaction that is always rolled back.
     * The transaction begins DEFERRED, so a read-only function never waits on a writer.
     */
    public <T> T executeAndRollback(TransactionFunction<T> function) throws SQLException {
        return runInTransaction(function, false);
    }

    /**
     * Execute a function on an auto-commit connection.
     */
    public <T> T executeRead(TransactionFunction<T> function) throws SQLException {
        try (Connection conn = openConnection()) {
            return function.apply(conn);
        }
    }

    private <T> T runInTransaction(TransactionFunction<T> function, boolean commit) throws SQLException {
        SQLiteConfig.TransactionMode mode = commit
            ? SQLiteConfig.TransactionMode.IMMEDIATE
            : SQLiteConfig.TransactionMode.DEFERRED;
        try (Connection conn = openConnection(mode)) {
            conn.setAutoCommit(false);
            T result;
            try {
                result = function.apply(conn);
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
            if (commit) {
                conn.commit();
            } else {
                conn.rollback();
            }
            return result;
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed: {}", rollbackEx.getMessage());
            cause.addSuppressed(rollbackEx);
        }
    }

    /**
     * Functional interface for transactional operations returning a value.
     */
    @FunctionalInterface
    public interface TransactionFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    /**
     * Functional interface for transactional operations with no return value.
     */
    @FunctionalInterface
    public interface TransactionConsumer {
        void accept(Connection connection) throws SQLException;
    }
}
