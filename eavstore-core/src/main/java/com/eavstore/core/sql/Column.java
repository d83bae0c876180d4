package com.eavstore.core.sql;

/**
 * Column definition: name, SQL type and trailing constraint text used in DDL.
 */
public record Column(String name, String sqlType, String constraints) {

    public static Column of(String name, String sqlType) {
        return new Column(name, sqlType, "");
    }

    public static Column of(String name, String sqlType, String constraints) {
        return new Column(name, sqlType, constraints);
    }
}
