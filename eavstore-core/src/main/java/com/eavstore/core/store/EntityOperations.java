package com.eavstore.core.store;

import com.eavstore.core.model.Entity;
import com.eavstore.core.query.EntityQuery;
import com.eavstore.core.value.AttrValue;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entity-level API of the store.
 */
public interface EntityOperations {

    /**
     * Insert an entity and its attributes, then read it back.
     *
     * @param key   entity key, or null to generate one
     * @param attrs initial attributes, may be null
     * @throws DuplicateEntityException if the key is taken
     */
    Entity createEnt(String key, Map<String, AttrValue> attrs) throws SQLException;

    /**
     * Replace and delete attributes in one transaction and advance {@code modified}.
     * A name present in both {@code patches} and {@code deletions} is deleted.
     *
     * @param expectedModified when non-null, the update only applies if the entity's
     *                         {@code modified} still equals it
     * @throws StaleEntityException    if {@code expectedModified} no longer matches
     * @throws EntityNotFoundException if no entity has this key
     */
    void updateEnt(String key, Map<String, AttrValue> patches, Collection<String> deletions,
                   Long expectedModified) throws SQLException;

    /**
     * Create the entity, or update it if the key already exists.
     *
     * @return the created entity, or empty when an existing entity was updated
     */
    Optional<Entity> upsertEnt(String key, Map<String, AttrValue> patches, Collection<String> deletions)
        throws SQLException;

    /**
     * Entities matching the query, keyed by entity key.
     */
    Map<String, Entity> queryEnts(EntityQuery query) throws SQLException;

    default Entity createEnt(Map<String, AttrValue> attrs) throws SQLException {
        return createEnt(null, attrs);
    }

    default void updateEnt(String key, Map<String, AttrValue> patches) throws SQLException {
        updateEnt(key, patches, List.of(), null);
    }

    default Optional<Entity> getEnt(String key) throws SQLException {
        return Optional.ofNullable(queryEnts(EntityQuery.byKey(key)).get(key));
    }
}
