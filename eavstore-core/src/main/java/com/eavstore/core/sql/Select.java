package com.eavstore.core.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable SELECT statement. Each {@code with*} method returns a new instance.
 */
public record Select(boolean distinct, List<Selected> columns, FromItem from, List<Join> joins, List<Condition> where) {

    public Select {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("SELECT needs at least one column");
        }
        columns = List.copyOf(columns);
        joins = List.copyOf(joins);
        where = List.copyOf(where);
    }

    public static Select from(FromItem from, Selected... columns) {
        return new Select(false, List.of(columns), from, List.of(), List.of());
    }

    public static Select from(FromItem from, List<Selected> columns) {
        return new Select(false, columns, from, List.of(), List.of());
    }

    public Select asDistinct() {
        return new Select(true, columns, from, joins, where);
    }

    public Select join(JoinType type, FromItem item, Condition on) {
        List<Join> next = new ArrayList<>(joins);
        next.add(new Join(type, item, on));
        return new Select(distinct, columns, from, next, where);
    }

    public Select where(Condition condition) {
        List<Condition> next = new ArrayList<>(where);
        next.add(condition);
        return new Select(distinct, columns, from, joins, next);
    }

    public Subquery as(String alias) {
        return new Subquery(this, alias);
    }
}
