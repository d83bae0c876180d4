package com.eavstore.core.sql;

import java.util.Collection;
import java.util.List;

/**
 * Qualified column reference, e.g. {@code outer_ents.key}.
 */
public record ColumnRef(String qualifier, String column) implements SqlExpr {

    public Selected as(String label) {
        return new Selected(this, label);
    }

    public Condition eq(SqlExpr other) {
        return new Condition.Compare(this, "=", other);
    }

    public Condition eq(Object value) {
        return compare("=", value);
    }

    public Condition compare(String op, Object value) {
        return new Condition.Compare(this, op, SqlExpr.param(value));
    }

    public Condition in(Collection<?> values) {
        return new Condition.In(this, List.copyOf(values));
    }
}
