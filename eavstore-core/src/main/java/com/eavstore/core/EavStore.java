package com.eavstore.core;

import com.eavstore.core.config.EavStoreConfig;
import com.eavstore.core.schema.EavSchema;
import com.eavstore.core.store.EavDatabase;
import com.eavstore.core.store.EntityDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

/**
 * Main entry point: wires configuration, database, schema and DAO for one store.
 */
public class EavStore {

    private static final Logger log = LoggerFactory.getLogger(EavStore.class);

    private final EavDatabase database;
    private final EavSchema schema;
    private final EntityDao entities;

    private EavStore(EavDatabase database, EavSchema schema) {
        this.database = database;
        this.schema = schema;
        this.entities = new EntityDao(database, schema);
    }

    /**
     * Open the store described by {@code config} and create its tables if needed.
     */
    public static EavStore open(EavStoreConfig config) throws SQLException {
        return open(config, EavSchema.standard());
    }

    public static EavStore open(EavStoreConfig config, EavSchema schema) throws SQLException {
        EavStore store = new EavStore(new EavDatabase(config), schema);
        store.entities.ensureTables();
        log.info("Opened EAV store at {}", config.getDatabasePath());
        return store;
    }

    /**
     * Open the store configured through system properties and environment.
     */
    public static EavStore open() throws SQLException {
        return open(EavStoreConfig.load());
    }

    public EavDatabase getDatabase() {
        return database;
    }

    public EavSchema getSchema() {
        return schema;
    }

    public EntityDao entities() {
        return entities;
    }
}
