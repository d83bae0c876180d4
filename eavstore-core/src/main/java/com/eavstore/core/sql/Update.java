package com.eavstore.core.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Update(Table table, Map<String, SqlExpr> assignments, List<Condition> where) {

    public Update {
        assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        where = List.copyOf(where);
    }

    public static Update table(Table table) {
        return new Update(table, Map.of(), List.of());
    }

    public Update set(String column, SqlExpr value) {
        table.col(column);
        Map<String, SqlExpr> next = new LinkedHashMap<>(assignments);
        next.put(column, value);
        return new Update(table, next, where);
    }

    public Update where(Condition condition) {
        List<Condition> next = new ArrayList<>(where);
        next.add(condition);
        return new Update(table, assignments, next);
    }
}
