package com.eavstore.core.store;

import java.sql.SQLException;

/**
 * An entity with this key already exists.
 */
public class DuplicateEntityException extends SQLException {

    private final String key;

    public DuplicateEntityException(String key, SQLException cause) {
        super("Entity already exists: " + key, cause.getSQLState(), cause.getErrorCode(), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
