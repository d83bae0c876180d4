package com.eavstore.core.sql;

/**
 * Projected expression with its output label.
 */
public record Selected(SqlExpr expr, String label) {
}
