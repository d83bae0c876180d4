package com.eavstore.core.store;

import java.sql.SQLException;

/**
 * Optimistic concurrency check failed: the entity's {@code modified} timestamp
 * no longer matches the value the caller read.
 */
public class StaleEntityException extends SQLException {

    private final String key;
    private final long expectedModified;

    public StaleEntityException(String key, long expectedModified) {
        super("Entity " + key + " was modified since " + expectedModified);
        this.key = key;
        this.expectedModified = expectedModified;
    }

    public String getKey() {
        return key;
    }

    public long getExpectedModified() {
        return expectedModified;
    }
}
