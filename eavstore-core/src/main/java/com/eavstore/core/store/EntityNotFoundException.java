package com.eavstore.core.store;

import java.sql.SQLException;

public class EntityNotFoundException extends SQLException {

    private final String key;

    public EntityNotFoundException(String key) {
        super("No entity with key " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
