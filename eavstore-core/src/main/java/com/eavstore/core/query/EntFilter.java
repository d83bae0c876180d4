package com.eavstore.core.query;

import java.util.Objects;

/**
 * Comparison against an entity column ({@code key}, {@code created} or {@code modified}).
 */
public record EntFilter(String col, String op, Object arg) {

    public EntFilter {
        Objects.requireNonNull(col, "col");
        Objects.requireNonNull(op, "op");
    }

    public static EntFilter keyEquals(String key) {
        return new EntFilter("key", "=", key);
    }
}
