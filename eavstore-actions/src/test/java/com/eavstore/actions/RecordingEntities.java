package com.eavstore.actions;

import com.eavstore.core.model.Entity;
import com.eavstore.core.query.EntityQuery;
import com.eavstore.core.store.EntityOperations;
import com.eavstore.core.store.StaleEntityException;
import com.eavstore.core.value.AttrValue;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory EntityOperations that records calls instead of touching a database.
 */
class RecordingEntities implements EntityOperations {

    record Call(String method, String key, Map<String, AttrValue> patches, List<String> deletions,
                Long expectedModified) {
    }

    final List<Call> calls = new ArrayList<>();
    String staleKey;

    @Override
    public Entity createEnt(String key, Map<String, AttrValue> attrs) {
        calls.add(new Call("createEnt", key, attrs, List.of(), null));
        return new Entity(key, 1L, 1L, attrs);
    }

    @Override
    public void updateEnt(String key, Map<String, AttrValue> patches, Collection<String> deletions,
                          Long expectedModified) throws SQLException {
        if (key.equals(staleKey)) {
            throw new StaleEntityException(key, expectedModified != null ? expectedModified : 0L);
        }
        calls.add(new Call("updateEnt", key, patches, List.copyOf(deletions), expectedModified));
    }

    @Override
    public Optional<Entity> upsertEnt(String key, Map<String, AttrValue> patches, Collection<String> deletions) {
        calls.add(new Call("upsertEnt", key, patches, List.copyOf(deletions), null));
        return Optional.of(new Entity(key, 1L, 1L, patches));
    }

    @Override
    public Map<String, Entity> queryEnts(EntityQuery query) {
        calls.add(new Call("queryEnts", null, Map.of(), List.of(), null));
        return Map.of();
    }
}
