package com.eavstore.actions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One recorded entity operation: {@code {"type": "upsert_ent", "params": {...}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Action(@JsonProperty("type") String type, @JsonProperty("params") ObjectNode params) {

    public Action {
        if (params == null) {
            params = JsonNodeFactory.instance.objectNode();
        }
    }

    public static Action of(ActionType type, ObjectNode params) {
        return new Action(type.getValue(), params);
    }
}
