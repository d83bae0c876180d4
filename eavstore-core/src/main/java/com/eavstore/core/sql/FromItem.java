package com.eavstore.core.sql;

/**
 * Something a SELECT can read from: a table (optionally aliased) or an aliased subquery.
 */
public sealed interface FromItem permits Table, Subquery {

    /**
     * Name used to qualify column references (the alias when present).
     */
    String reference();

    ColumnRef col(String column);
}
