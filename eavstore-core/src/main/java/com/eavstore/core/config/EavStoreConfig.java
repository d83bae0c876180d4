package com.eavstore.core.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration for an EAV store.
 */
public class EavStoreConfig {
    private static final String DEFAULT_DB_PATH = System.getProperty("user.home") + "/.eavstore/eav.db";
    private static final int DEFAULT_BUSY_TIMEOUT_MS = 5000;
    private static final String DEFAULT_JOURNAL_MODE = "WAL";

    private final Path databasePath;
    private final int busyTimeoutMs;
    private final String journalMode;

    public EavStoreConfig(Path databasePath, int busyTimeoutMs, String journalMode) {
        if (busyTimeoutMs < 0) {
            throw new IllegalArgumentException("busy timeout must be >= 0, got " + busyTimeoutMs);
        }
        if (!journalMode.matches("[A-Za-z]+")) {
            throw new IllegalArgumentException("Invalid journal mode: " + journalMode);
        }
        this.databasePath = databasePath;
        this.busyTimeoutMs = busyTimeoutMs;
        this.journalMode = journalMode.toUpperCase();
    }

    public static EavStoreConfig forPath(Path databasePath) {
        return new EavStoreConfig(databasePath, DEFAULT_BUSY_TIMEOUT_MS, DEFAULT_JOURNAL_MODE);
    }

    public static EavStoreConfig load() {
        // Load from environment or system properties, with sensible defaults
        String dbPath = System.getProperty("eavstore.db.path",
            System.getenv().getOrDefault("EAVSTORE_DB_PATH", DEFAULT_DB_PATH));

        int busyTimeout = Integer.parseInt(System.getProperty("eavstore.busy_timeout_ms",
            System.getenv().getOrDefault("EAVSTORE_BUSY_TIMEOUT_MS", String.valueOf(DEFAULT_BUSY_TIMEOUT_MS))));

        String journalMode = System.getProperty("eavstore.journal_mode",
            System.getenv().getOrDefault("EAVSTORE_JOURNAL_MODE", DEFAULT_JOURNAL_MODE));

        return new EavStoreConfig(Paths.get(dbPath), busyTimeout, journalMode);
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    public String getJdbcUrl() {
        return "jdbc:sqlite:" + databasePath.toAbsolutePath();
    }

    public int getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    public String getJournalMode() {
        return journalMode;
    }
}
