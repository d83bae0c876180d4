package com.eavstore.actions;

import java.util.Optional;

/**
 * Entity operations that may appear in an action log.
 */
public enum ActionType {
    UPDATE_ENT("update_ent"),
    UPSERT_ENT("upsert_ent");

    private final String value;

    ActionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<ActionType> fromValue(String value) {
        for (ActionType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
