package com.eavstore.core.sql;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Renders statement trees into parameterized SQL.
 *
 * Identifiers are always double-quoted; every literal value becomes a {@code ?}
 * placeholder, appended to the parameter list in the order it appears in the text.
 */
public final class SqlRenderer {

    private final StringBuilder sql = new StringBuilder();
    private final List<Object> params = new ArrayList<>();

    private SqlRenderer() {
    }

    public static CompiledStatement render(Select select) {
        SqlRenderer r = new SqlRenderer();
        r.select(select);
        return r.done();
    }

    public static CompiledStatement render(Insert insert) {
        SqlRenderer r = new SqlRenderer();
        r.sql.append("INSERT INTO ").append(quote(insert.table().name())).append(" (");
        r.sql.append(String.join(", ", insert.columns().stream().map(SqlRenderer::quote).toList()));
        r.sql.append(") VALUES (");
        r.sql.append(String.join(", ", insert.columns().stream().map(c -> "?").toList()));
        r.sql.append(")");
        return r.done();
    }

    public static CompiledStatement render(Update update) {
        if (update.assignments().isEmpty()) {
            throw new IllegalArgumentException("UPDATE of " + update.table().name() + " sets no columns");
        }
        SqlRenderer r = new SqlRenderer();
        r.sql.append("UPDATE ").append(quote(update.table().name())).append(" SET ");
        Iterator<Map.Entry<String, SqlExpr>> it = update.assignments().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, SqlExpr> e = it.next();
            r.sql.append(quote(e.getKey())).append(" = ");
            r.expr(e.getValue());
            if (it.hasNext()) r.sql.append(", ");
        }
        r.whereClause(update.where());
        return r.done();
    }

    public static CompiledStatement render(Delete delete) {
        SqlRenderer r = new SqlRenderer();
        r.sql.append("DELETE FROM ").append(quote(delete.table().name()));
        r.whereClause(delete.where());
        return r.done();
    }

    private CompiledStatement done() {
        return new CompiledStatement(sql.toString(), params);
    }

    // ==================== SELECT ====================

    private void select(Select select) {
        sql.append(select.distinct() ? "SELECT DISTINCT " : "SELECT ");
        List<Selected> columns = select.columns();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sql.append(", ");
            Selected s = columns.get(i);
            expr(s.expr());
            sql.append(" AS ").append(quote(s.label()));
        }
        sql.append(" FROM ");
        fromItem(select.from());
        for (Join join : select.joins()) {
            sql.append(' ').append(join.type().keyword()).append(' ');
            fromItem(join.item());
            sql.append(" ON ");
            condition(join.on());
        }
        whereClause(select.where());
    }

    private void fromItem(FromItem item) {
        if (item instanceof Table t) {
            sql.append(quote(t.name()));
            if (t.alias() != null) {
                sql.append(" AS ").append(quote(t.alias()));
            }
        } else if (item instanceof Subquery s) {
            sql.append('(');
            select(s.select());
            sql.append(") AS ").append(quote(s.alias()));
        }
    }

    private void whereClause(List<Condition> where) {
        if (where.isEmpty()) return;
        sql.append(" WHERE ");
        condition(Condition.and(where));
    }

    // ==================== Expressions ====================

    private void condition(Condition c) {
        if (c instanceof Condition.Compare cmp) {
            expr(cmp.left());
            sql.append(' ').append(cmp.op()).append(' ');
            expr(cmp.right());
        } else if (c instanceof Condition.In in) {
            expr(in.left());
            sql.append(" IN (");
            for (int i = 0; i < in.values().size(); i++) {
                if (i > 0) sql.append(", ");
                sql.append('?');
                params.add(in.values().get(i));
            }
            sql.append(')');
        } else if (c instanceof Condition.Not not) {
            sql.append("NOT (");
            condition(not.inner());
            sql.append(')');
        } else if (c instanceof Condition.And and) {
            if (and.parts().isEmpty()) {
                sql.append("1 = 1");
                return;
            }
            for (int i = 0; i < and.parts().size(); i++) {
                if (i > 0) sql.append(" AND ");
                sql.append('(');
                condition(and.parts().get(i));
                sql.append(')');
            }
        } else if (c instanceof Condition.Exists exists) {
            sql.append("EXISTS (");
            select(exists.subquery());
            sql.append(')');
        }
    }

    private void expr(SqlExpr e) {
        if (e instanceof ColumnRef ref) {
            sql.append(quote(ref.qualifier())).append('.').append(quote(ref.column()));
        } else if (e instanceof SqlExpr.Param p) {
            sql.append('?');
            params.add(p.value());
        } else if (e instanceof SqlExpr.Call call) {
            sql.append(call.function()).append('(');
            for (int i = 0; i < call.args().size(); i++) {
                if (i > 0) sql.append(", ");
                expr(call.args().get(i));
            }
            sql.append(')');
        } else if (e instanceof SqlExpr.Arith a) {
            sql.append('(');
            expr(a.left());
            sql.append(' ').append(a.op()).append(' ');
            expr(a.right());
            sql.append(')');
        }
    }

    static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }
}
