package com.eavstore.actions;

import com.eavstore.core.value.AttrValue;
import com.eavstore.core.value.ValueCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of an action's params.
 *
 * Accepted names: {@code key} (or {@code ent_key}), {@code patches} (or {@code attr_patches}),
 * {@code deletions} (or {@code attr_deletions}), {@code expected_modified} (or {@code ent_modified}).
 */
public record ActionParams(String key, Map<String, AttrValue> patches, List<String> deletions, Long expectedModified) {

    public static ActionParams parse(Action action, ValueCodec codec) {
        ObjectNode params = action.params();

        JsonNode key = field(params, "key", "ent_key");
        if (key == null || !key.isTextual()) {
            throw new InvalidActionException("Action has no string key", action);
        }

        Map<String, AttrValue> patches = new LinkedHashMap<>();
        JsonNode patchNode = field(params, "patches", "attr_patches");
        if (patchNode != null && !patchNode.isNull()) {
            if (!patchNode.isObject()) {
                throw new InvalidActionException("patches must be an object", action);
            }
            Iterator<Map.Entry<String, JsonNode>> fields = patchNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                patches.put(e.getKey(), codec.fromJson(e.getValue()));
            }
        }

        List<String> deletions = new ArrayList<>();
        JsonNode deletionNode = field(params, "deletions", "attr_deletions");
        if (deletionNode != null && !deletionNode.isNull()) {
            if (!deletionNode.isArray()) {
                throw new InvalidActionException("deletions must be an array", action);
            }
            for (JsonNode name : deletionNode) {
                if (!name.isTextual()) {
                    throw new InvalidActionException("deletions must be attribute names", action);
                }
                deletions.add(name.textValue());
            }
        }

        Long expectedModified = null;
        JsonNode modifiedNode = field(params, "expected_modified", "ent_modified");
        if (modifiedNode != null && !modifiedNode.isNull()) {
            if (!modifiedNode.canConvertToLong() || !modifiedNode.isIntegralNumber()) {
                throw new InvalidActionException("expected_modified must be an integer", action);
            }
            expectedModified = modifiedNode.longValue();
        }

        return new ActionParams(key.textValue(), patches, deletions, expectedModified);
    }

    private static JsonNode field(ObjectNode params, String name, String alias) {
        JsonNode node = params.get(name);
        return node != null ? node : params.get(alias);
    }

    /**
     * JSON form written to action logs.
     */
    public ObjectNode toJson(ValueCodec codec) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("key", key);
        if (patches != null && !patches.isEmpty()) {
            ObjectNode patchNode = node.putObject("patches");
            patches.forEach((name, value) -> patchNode.set(name, codec.toJson(value)));
        }
        if (deletions != null && !deletions.isEmpty()) {
            deletions.forEach(node.putArray("deletions")::add);
        }
        if (expectedModified != null) {
            node.put("expected_modified", expectedModified);
        }
        return node;
    }
}
