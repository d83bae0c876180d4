package com.eavstore.core.sql;

/**
 * A SELECT used as a join source under an alias.
 */
public record Subquery(Select select, String alias) implements FromItem {

    @Override
    public String reference() {
        return alias;
    }

    @Override
    public ColumnRef col(String column) {
        for (Selected s : select.columns()) {
            if (s.label().equals(column)) {
                return new ColumnRef(alias, column);
            }
        }
        throw new IllegalArgumentException("Subquery " + alias + " does not project " + column);
    }
}
