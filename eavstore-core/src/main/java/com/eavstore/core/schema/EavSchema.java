package com.eavstore.core.schema;

import com.eavstore.core.sql.Column;
import com.eavstore.core.sql.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.StringJoiner;
import java.util.UUID;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * The two EAV relations plus the key and timestamp policy.
 *
 * <pre>
 * ents  (key, created, modified)
 * attrs (key, ent_key -> ents.key, attr, value, type, modified)
 * </pre>
 *
 * One instance is built per store and handed to the DAO. {@link #createAll} and
 * {@link #dropAll} manage the physical tables.
 */
public class EavSchema {

    private static final Logger log = LoggerFactory.getLogger(EavSchema.class);

    // Current schema version - increment when schema changes
    public static final int CURRENT_VERSION = 1;

    public static final String DEFAULT_ENTS_TABLE = "ents";
    public static final String DEFAULT_ATTRS_TABLE = "attrs";

    // Entity columns
    public static final String KEY = "key";
    public static final String CREATED = "created";
    public static final String MODIFIED = "modified";

    // Attribute columns
    public static final String ENT_KEY = "ent_key";
    public static final String ATTR = "attr";
    public static final String VALUE = "value";
    public static final String TYPE = "type";

    private final Table ents;
    private final Table attrs;
    private final String versionTable;
    private final Supplier<String> keyGenerator;
    private final LongSupplier clock;

    public EavSchema(String entsTable, String attrsTable, Supplier<String> keyGenerator, LongSupplier clock) {
        this.ents = Table.define(entsTable,
            Column.of(KEY, "TEXT", "PRIMARY KEY"),
            Column.of(CREATED, "INTEGER", "NOT NULL"),
            Column.of(MODIFIED, "INTEGER", "NOT NULL"));
        this.attrs = Table.define(attrsTable,
            Column.of(KEY, "TEXT", "PRIMARY KEY"),
            Column.of(ENT_KEY, "TEXT", "NOT NULL REFERENCES \"" + entsTable + "\" (\"" + KEY + "\")"),
            Column.of(ATTR, "TEXT", "NOT NULL"),
            Column.of(VALUE, "TEXT"),
            Column.of(TYPE, "TEXT"),
            Column.of(MODIFIED, "INTEGER", "NOT NULL"));
        this.versionTable = entsTable + "_schema_version";
        this.keyGenerator = keyGenerator;
        this.clock = clock;
    }

    /**
     * Default schema: tables {@code ents} and {@code attrs}, random UUID keys, wall-clock millis.
     */
    public static EavSchema standard() {
        return new EavSchema(DEFAULT_ENTS_TABLE, DEFAULT_ATTRS_TABLE, EavSchema::randomKey, System::currentTimeMillis);
    }

    /**
     * Same tables and keys, different time source.
     */
    public EavSchema withClock(LongSupplier clock) {
        return new EavSchema(ents.name(), attrs.name(), keyGenerator, clock);
    }

    public static String randomKey() {
        return UUID.randomUUID().toString();
    }

    public Table ents() {
        return ents;
    }

    public Table attrs() {
        return attrs;
    }

    public String generateKey() {
        return keyGenerator.get();
    }

    /**
     * Milliseconds since epoch. Not guaranteed to increase between calls.
     */
    public long now() {
        return clock.getAsLong();
    }

    // ==================== Lifecycle ====================

    /**
     * Create both tables and their indexes if they don't exist.
     */
    public void createAll(Connection conn) throws SQLException {
        int currentVersion = getSchemaVersion(conn);

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS \"" + versionTable + "\" ("
                + "version INTEGER PRIMARY KEY, applied_at INTEGER NOT NULL)");
            stmt.execute(createTableSql(ents));
            stmt.execute(createTableSql(attrs));
            stmt.execute(createIndexSql(attrs, ENT_KEY));
            stmt.execute(createIndexSql(attrs, ATTR));
        }

        if (currentVersion < CURRENT_VERSION) {
            setSchemaVersion(conn, CURRENT_VERSION);
            log.info("Created EAV schema v{} ({}, {})", CURRENT_VERSION, ents.name(), attrs.name());
        } else {
            log.debug("EAV schema v{} up to date", currentVersion);
        }
    }

    /**
     * Drop both tables and the version table. Attributes go first because they reference entities.
     */
    public void dropAll(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS \"" + attrs.name() + "\"");
            stmt.execute("DROP TABLE IF EXISTS \"" + ents.name() + "\"");
            stmt.execute("DROP TABLE IF EXISTS \"" + versionTable + "\"");
        }
        log.info("Dropped EAV schema ({}, {})", ents.name(), attrs.name());
    }

    /**
     * Get the current schema version (0 if none set).
     */
    public int getSchemaVersion(Connection conn) throws SQLException {
        try (ResultSet rs = conn.getMetaData().getTables(null, null, versionTable, null)) {
            if (!rs.next()) {
                return 0;
            }
        }

        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM \"" + versionTable + "\"")) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }

    private void setSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT OR REPLACE INTO \"" + versionTable + "\" (version, applied_at) VALUES (?, ?)")) {
            stmt.setInt(1, version);
            stmt.setLong(2, now());
            stmt.executeUpdate();
        }
    }

    static String createTableSql(Table table) {
        StringJoiner cols = new StringJoiner(", ", "CREATE TABLE IF NOT EXISTS \"" + table.name() + "\" (", ")");
        List<Column> columns = table.columns();
        for (Column c : columns) {
            String def = "\"" + c.name() + "\" " + c.sqlType();
            if (!c.constraints().isEmpty()) {
                def += " " + c.constraints();
            }
            cols.add(def);
        }
        return cols.toString();
    }

    static String createIndexSql(Table table, String column) {
        return "CREATE INDEX IF NOT EXISTS \"idx_" + table.name() + "_" + column + "\" ON \""
            + table.name() + "\" (\"" + column + "\")";
    }
}
