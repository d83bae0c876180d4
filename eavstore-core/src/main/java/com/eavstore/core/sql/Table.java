package com.eavstore.core.sql;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table definition usable both for DDL and as a query source.
 * Aliasing returns a new instance sharing the same columns.
 */
public final class Table implements FromItem {

    private final String name;
    private final String alias;
    private final Map<String, Column> columns;

    private Table(String name, String alias, Map<String, Column> columns) {
        this.name = name;
        this.alias = alias;
        this.columns = columns;
    }

    public static Table define(String name, Column... columns) {
        Map<String, Column> byName = new LinkedHashMap<>();
        for (Column c : columns) {
            if (byName.put(c.name(), c) != null) {
                throw new IllegalArgumentException("Duplicate column " + c.name() + " in " + name);
            }
        }
        return new Table(name, null, byName);
    }

    public Table alias(String alias) {
        return new Table(name, alias, columns);
    }

    public String name() {
        return name;
    }

    public String alias() {
        return alias;
    }

    @Override
    public String reference() {
        return alias != null ? alias : name;
    }

    public List<Column> columns() {
        return List.copyOf(columns.values());
    }

    public boolean hasColumn(String column) {
        return columns.containsKey(column);
    }

    @Override
    public ColumnRef col(String column) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("Table " + name + " has no column " + column);
        }
        return new ColumnRef(reference(), column);
    }

    @Override
    public String toString() {
        return alias != null ? name + " AS " + alias : name;
    }
}
