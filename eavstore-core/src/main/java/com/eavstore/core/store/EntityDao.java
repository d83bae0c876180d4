package com.eavstore.core.store;

import com.eavstore.core.model.Entity;
import com.eavstore.core.query.EntityQuery;
import com.eavstore.core.query.EntityQueryCompiler;
import com.eavstore.core.schema.EavSchema;
import com.eavstore.core.sql.CompiledStatement;
import com.eavstore.core.sql.Delete;
import com.eavstore.core.sql.Insert;
import com.eavstore.core.sql.SqlExpr;
import com.eavstore.core.sql.SqlRenderer;
import com.eavstore.core.sql.Table;
import com.eavstore.core.sql.Update;
import com.eavstore.core.value.AttrValue;
import com.eavstore.core.value.EncodedValue;
import com.eavstore.core.value.ValueCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * DAO for entities and their attributes.
 * Every public operation runs on its own connection and, where it writes, its own transaction.
 */
public class EntityDao implements EntityOperations {

    private final EavDatabase db;
    private final EavSchema schema;
    private final ValueCodec codec;
    private final EntityQueryCompiler compiler;
    private final EntityAssembler assembler;
    private final Logger log;

    public EntityDao(EavDatabase db, EavSchema schema) {
        this(db, schema, new ValueCodec(), null);
    }

    public EntityDao(EavDatabase db, EavSchema schema, ValueCodec codec, Logger logger) {
        this.db = db;
        this.schema = schema;
        this.codec = codec;
        this.compiler = new EntityQueryCompiler(schema, codec);
        this.assembler = new EntityAssembler(codec);
        this.log = logger != null ? logger : LoggerFactory.getLogger(EntityDao.class);
    }

    public EavSchema getSchema() {
        return schema;
    }

    public String generateKey() {
        return schema.generateKey();
    }

    // ==================== Tables ====================

    public void ensureTables() throws SQLException {
        createTables();
    }

    public void createTables() throws SQLException {
        db.executeInTransaction(schema::createAll);
    }

    public void dropTables() throws SQLException {
        db.executeInTransaction(schema::dropAll);
    }

    // ==================== Create ====================

    @Override
    public Entity createEnt(String key, Map<String, AttrValue> attrs) throws SQLException {
        String entKey = key != null ? key : generateKey();
        Entity entity = db.executeInTransaction(c -> {
            long now = schema.now();
            insertEnt(c, entKey, now);
            insertAttrs(c, entKey, attrs, now);
            return queryEnts(c, compiler.compile(EntityQuery.byKey(entKey))).get(entKey);
        });
        log.debug("Created entity {} with {} attrs", entKey, entity.attrs().size());
        return entity;
    }

    private void insertEnt(Connection c, String key, long now) throws SQLException {
        Table ents = schema.ents();
        CompiledStatement insert = SqlRenderer.render(
            Insert.into(ents, EavSchema.KEY, EavSchema.CREATED, EavSchema.MODIFIED));

        try (PreparedStatement stmt = insert.prepare(c)) {
            insert.bindRow(stmt, List.of(key, now, now));
            stmt.executeUpdate();
        } catch (SQLException e) {
            if (SqlErrors.isUniqueViolation(e)) {
                throw new DuplicateEntityException(key, e);
            }
            throw e;
        }
    }

    private void insertAttrs(Connection c, String entKey, Map<String, AttrValue> attrs, long now)
            throws SQLException {
        if (attrs == null || attrs.isEmpty()) return;

        CompiledStatement insert = SqlRenderer.render(Insert.into(schema.attrs(),
            EavSchema.KEY, EavSchema.ENT_KEY, EavSchema.ATTR, EavSchema.VALUE, EavSchema.TYPE, EavSchema.MODIFIED));

        try (PreparedStatement stmt = insert.prepare(c)) {
            for (Map.Entry<String, AttrValue> attr : attrs.entrySet()) {
                EncodedValue encoded = codec.serialize(attr.getValue());
                insert.bindRow(stmt, Arrays.asList(
                    generateKey(), entKey, attr.getKey(), encoded.text(), encoded.type(), now));
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    // ==================== Update ====================

    @Override
    public void updateEnt(String key, Map<String, AttrValue> patches, Collection<String> deletions,
                          Long expectedModified) throws SQLException {
        if (key == null) {
            throw new IllegalArgumentException("updateEnt requires a key");
        }
        Map<String, AttrValue> safePatches = patches != null ? patches : Map.of();
        Set<String> safeDeletions = deletionSet(deletions);

        db.executeInTransaction(c -> {
            long now = schema.now();
            // Version step first: a missing or stale entity fails before any attribute is touched
            if (expectedModified != null) {
                advanceModifiedIfUnchanged(c, key, expectedModified, now);
            } else {
                advanceModified(c, key, now);
            }

            Set<String> toDelete = new LinkedHashSet<>(safePatches.keySet());
            toDelete.addAll(safeDeletions);
            deleteAttrs(c, key, toDelete);
            insertAttrs(c, key, withoutDeletions(safePatches, safeDeletions), now);
        });
        log.debug("Updated entity {}: {} patches, {} deletions", key, safePatches.size(), safeDeletions.size());
    }

    /**
     * Advance {@code modified} only if it still equals {@code expectedModified}.
     */
    private void advanceModifiedIfUnchanged(Connection c, String key, long expectedModified, long now)
            throws SQLException {
        Table ents = schema.ents();
        CompiledStatement update = SqlRenderer.render(Update.table(ents)
            .set(EavSchema.MODIFIED, nextModified(ents, now))
            .where(ents.col(EavSchema.KEY).eq(key))
            .where(ents.col(EavSchema.MODIFIED).eq(expectedModified)));

        try (PreparedStatement stmt = update.prepare(c)) {
            if (stmt.executeUpdate() != 1) {
                log.warn("Rejected stale update of entity {} (expected modified {})", key, expectedModified);
                throw new StaleEntityException(key, expectedModified);
            }
        }
    }

    private void advanceModified(Connection c, String key, long now) throws SQLException {
        Table ents = schema.ents();
        CompiledStatement update = SqlRenderer.render(Update.table(ents)
            .set(EavSchema.MODIFIED, nextModified(ents, now))
            .where(ents.col(EavSchema.KEY).eq(key)));

        try (PreparedStatement stmt = update.prepare(c)) {
            if (stmt.executeUpdate() == 0) {
                throw new EntityNotFoundException(key);
            }
        }
    }

    // max(now, modified + 1): versions stay distinct within one millisecond
    private static SqlExpr nextModified(Table ents, long now) {
        return SqlExpr.call("MAX", SqlExpr.param(now), ents.col(EavSchema.MODIFIED).plus(1));
    }

    private void deleteAttrs(Connection c, String entKey, Collection<String> names) throws SQLException {
        if (names.isEmpty()) return;

        Table attrs = schema.attrs();
        CompiledStatement delete = SqlRenderer.render(Delete.from(attrs)
            .where(attrs.col(EavSchema.ENT_KEY).eq(entKey))
            .where(attrs.col(EavSchema.ATTR).in(names)));

        try (PreparedStatement stmt = delete.prepare(c)) {
            stmt.executeUpdate();
        }
    }

    private static Set<String> deletionSet(Collection<String> deletions) {
        if (deletions == null) {
            return Set.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (String name : deletions) {
            if (name == null) {
                throw new IllegalArgumentException("deletions must not contain null");
            }
            names.add(name);
        }
        return names;
    }

    private static Map<String, AttrValue> withoutDeletions(Map<String, AttrValue> patches, Set<String> deletions) {
        Map<String, AttrValue> surviving = new LinkedHashMap<>();
        patches.forEach((name, value) -> {
            if (!deletions.contains(name)) {
                surviving.put(name, value);
            }
        });
        return surviving;
    }

    // ==================== Upsert ====================

    @Override
    public Optional<Entity> upsertEnt(String key, Map<String, AttrValue> patches, Collection<String> deletions)
            throws SQLException {
        Map<String, AttrValue> safePatches = patches != null ? patches : Map.of();
        Set<String> safeDeletions = deletionSet(deletions);
        try {
            return Optional.of(createEnt(key, withoutDeletions(safePatches, safeDeletions)));
        } catch (DuplicateEntityException e) {
            log.debug("Entity {} exists, upsert falls back to update", key);
        }
        updateEnt(key, safePatches, safeDeletions, null);
        return Optional.empty();
    }

    // ==================== Query ====================

    @Override
    public Map<String, Entity> queryEnts(EntityQuery query) throws SQLException {
        // Compile first so bad filters fail before a connection is opened
        CompiledStatement statement = compiler.compile(query);
        return db.executeRead(c -> queryEnts(c, statement));
    }

    private Map<String, Entity> queryEnts(Connection c, CompiledStatement statement) throws SQLException {
        log.debug("Entity query: {}", statement);
        List<EntityRow> rows = new ArrayList<>();
        try (PreparedStatement stmt = statement.prepare(c);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                rows.add(EntityRow.read(rs));
            }
        }
        return assembler.assemble(rows);
    }

    // ==================== Raw SQL ====================

    /**
     * Run arbitrary SQL with {@code :name} parameters in its own transaction.
     * Only {@link RwMode#WRITE} commits; everything else is rolled back.
     *
     * @return the result rows as column-label maps, or empty if the statement produced no result set
     */
    public Optional<List<Map<String, Object>>> executeSql(String sql, Map<String, ?> params, RwMode mode)
            throws SQLException {
        NamedParameters parsed = NamedParameters.parse(sql);
        List<Object> values = parsed.bind(params);
        EavDatabase.TransactionFunction<Optional<List<Map<String, Object>>>> run = c -> {
            try (PreparedStatement stmt = c.prepareStatement(parsed.sql())) {
                for (int i = 0; i < values.size(); i++) {
                    stmt.setObject(i + 1, values.get(i));
                }
                if (!stmt.execute()) {
                    return Optional.empty();
                }
                try (ResultSet rs = stmt.getResultSet()) {
                    return Optional.of(readRows(rs));
                }
            }
        };
        return mode == RwMode.WRITE ? db.executeInTransaction(run) : db.executeAndRollback(run);
    }

    public Optional<List<Map<String, Object>>> executeSql(String sql, Map<String, ?> params) throws SQLException {
        return executeSql(sql, params, RwMode.READ);
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }
}
