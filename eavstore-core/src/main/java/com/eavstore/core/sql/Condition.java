package com.eavstore.core.sql;

import java.util.List;
import java.util.Set;

/**
 * Boolean predicate tree rendered into WHERE and ON clauses.
 */
public sealed interface Condition
        permits Condition.Compare, Condition.In, Condition.Not, Condition.And, Condition.Exists {

    /**
     * Comparison operators that may appear in rendered SQL.
     */
    Set<String> COMPARISON_OPS = Set.of("=", "<>", "<", ">", "<=", ">=", "LIKE");

    record Compare(SqlExpr left, String op, SqlExpr right) implements Condition {
        public Compare {
            if (!COMPARISON_OPS.contains(op)) {
                throw new IllegalArgumentException("Unsupported comparison operator: " + op);
            }
        }
    }

    record In(SqlExpr left, List<Object> values) implements Condition {
        public In {
            if (values.isEmpty()) {
                throw new IllegalArgumentException("IN requires at least one value");
            }
        }
    }

    record Not(Condition inner) implements Condition {
    }

    record And(List<Condition> parts) implements Condition {
        public And {
            parts = List.copyOf(parts);
        }
    }

    record Exists(Select subquery) implements Condition {
    }

    default Condition negate() {
        return new Not(this);
    }

    static Condition and(List<Condition> parts) {
        return parts.size() == 1 ? parts.get(0) : new And(parts);
    }

    static Condition exists(Select subquery) {
        return new Exists(subquery);
    }
}
