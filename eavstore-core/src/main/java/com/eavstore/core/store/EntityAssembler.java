package com.eavstore.core.store;

import com.eavstore.core.model.Entity;
import com.eavstore.core.value.AttrValue;
import com.eavstore.core.value.ValueCodec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Folds flat entity/attribute rows into entities keyed by entity key.
 *
 * The first row seen for a key fixes the entity's timestamps; later rows only add
 * attributes. Rows with a null attribute name mark an entity without attributes.
 * Entities come out in the order their first row arrived.
 */
public class EntityAssembler {

    private final ValueCodec codec;

    public EntityAssembler(ValueCodec codec) {
        this.codec = codec;
    }

    public Map<String, Entity> assemble(Iterable<EntityRow> rows) {
        Map<String, Draft> drafts = new LinkedHashMap<>();
        for (EntityRow row : rows) {
            Draft draft = drafts.computeIfAbsent(row.entKey(),
                key -> new Draft(key, row.entCreated(), row.entModified()));
            if (row.attr() != null) {
                draft.attrs.put(row.attr(), codec.deserialize(row.value(), row.type()));
            }
        }

        Map<String, Entity> entities = new LinkedHashMap<>();
        drafts.forEach((key, draft) -> entities.put(key, draft.toEntity()));
        return entities;
    }

    private static final class Draft {
        private final String key;
        private final long created;
        private final long modified;
        private final Map<String, AttrValue> attrs = new LinkedHashMap<>();

        Draft(String key, long created, long modified) {
            this.key = key;
            this.created = created;
            this.modified = modified;
        }

        Entity toEntity() {
            return new Entity(key, created, modified, attrs);
        }
    }
}
