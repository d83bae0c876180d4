package com.eavstore.core.sql;

import java.util.List;
import java.util.Set;

/**
 * Scalar expression: a column, a bound parameter, a function call or simple arithmetic.
 */
public sealed interface SqlExpr permits ColumnRef, SqlExpr.Param, SqlExpr.Call, SqlExpr.Arith {

    Set<String> FUNCTIONS = Set.of("MAX", "MIN", "COALESCE");
    Set<String> ARITH_OPS = Set.of("+", "-");

    record Param(Object value) implements SqlExpr {
    }

    record Call(String function, List<SqlExpr> args) implements SqlExpr {
        public Call {
            if (!FUNCTIONS.contains(function)) {
                throw new IllegalArgumentException("Unsupported SQL function: " + function);
            }
            args = List.copyOf(args);
        }
    }

    record Arith(SqlExpr left, String op, SqlExpr right) implements SqlExpr {
        public Arith {
            if (!ARITH_OPS.contains(op)) {
                throw new IllegalArgumentException("Unsupported arithmetic operator: " + op);
            }
        }
    }

    static SqlExpr param(Object value) {
        return new Param(value);
    }

    static SqlExpr call(String function, SqlExpr... args) {
        return new Call(function, List.of(args));
    }

    default SqlExpr plus(long n) {
        return new Arith(this, "+", new Param(n));
    }
}
