package com.eavstore.core.sql;

import java.util.ArrayList;
import java.util.List;

public record Delete(Table table, List<Condition> where) {

    public Delete {
        where = List.copyOf(where);
    }

    public static Delete from(Table table) {
        return new Delete(table, List.of());
    }

    public Delete where(Condition condition) {
        List<Condition> next = new ArrayList<>(where);
        next.add(condition);
        return new Delete(table, next);
    }
}
