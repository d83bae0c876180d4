package com.eavstore.core.sql;

import java.util.List;

/**
 * INSERT of one row shape; values are bound per row through {@link CompiledStatement#bindRow}.
 */
public record Insert(Table table, List<String> columns) {

    public Insert {
        for (String c : columns) {
            table.col(c);
        }
        columns = List.copyOf(columns);
    }

    public static Insert into(Table table, String... columns) {
        return new Insert(table, List.of(columns));
    }
}
