package com.eavstore.core.query;

import com.eavstore.core.sql.Condition;
import com.eavstore.core.sql.Join;
import com.eavstore.core.sql.Selected;
import com.eavstore.core.sql.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Join graph and predicates accumulated while translating an {@link EntityQuery}.
 *
 * Immutable: every {@code with*} step returns a new instance, so a partially built
 * query is never shared in a modified state.
 *
 * @param outerEnts          aliased entity table driving the query
 * @param outerAttrs         aliased attribute table joined to {@code outerEnts}
 * @param columns            projected output columns
 * @param attrJoinConditions extra conditions on the outerEnts/outerAttrs join
 * @param joins              filter joins added after the base join, in order
 * @param wheres             predicates ANDed into the WHERE clause, in order
 * @param requiresAttrRow    true once a binary attribute filter applies (inner base join)
 * @param aliasCount         aliases handed out so far
 */
public record QueryComponents(
    Table outerEnts,
    Table outerAttrs,
    List<Selected> columns,
    List<Condition> attrJoinConditions,
    List<Join> joins,
    List<Condition> wheres,
    boolean requiresAttrRow,
    int aliasCount
) {

    public QueryComponents {
        columns = List.copyOf(columns);
        attrJoinConditions = List.copyOf(attrJoinConditions);
        joins = List.copyOf(joins);
        wheres = List.copyOf(wheres);
    }

    public QueryComponents withAttrJoinCondition(Condition condition) {
        return new QueryComponents(outerEnts, outerAttrs, columns, append(attrJoinConditions, condition),
            joins, wheres, requiresAttrRow, aliasCount);
    }

    public QueryComponents withJoin(Join join) {
        return new QueryComponents(outerEnts, outerAttrs, columns, attrJoinConditions,
            append(joins, join), wheres, requiresAttrRow, aliasCount);
    }

    public QueryComponents withWhere(Condition condition) {
        return new QueryComponents(outerEnts, outerAttrs, columns, attrJoinConditions,
            joins, append(wheres, condition), requiresAttrRow, aliasCount);
    }

    public QueryComponents requiringAttrRow() {
        return new QueryComponents(outerEnts, outerAttrs, columns, attrJoinConditions,
            joins, wheres, true, aliasCount);
    }

    /**
     * Reserve the next alias number. Returns the new state; read the number from {@link #aliasCount()}.
     */
    public QueryComponents nextAlias() {
        return new QueryComponents(outerEnts, outerAttrs, columns, attrJoinConditions,
            joins, wheres, requiresAttrRow, aliasCount + 1);
    }

    private static <T> List<T> append(List<T> list, T item) {
        List<T> next = new ArrayList<>(list.size() + 1);
        next.addAll(list);
        next.add(item);
        return next;
    }
}
