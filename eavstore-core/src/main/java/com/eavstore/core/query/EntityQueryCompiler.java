package com.eavstore.core.query;

import com.eavstore.core.schema.EavSchema;
import com.eavstore.core.sql.ColumnRef;
import com.eavstore.core.sql.CompiledStatement;
import com.eavstore.core.sql.Condition;
import com.eavstore.core.sql.Join;
import com.eavstore.core.sql.JoinType;
import com.eavstore.core.sql.Select;
import com.eavstore.core.sql.Selected;
import com.eavstore.core.sql.SqlRenderer;
import com.eavstore.core.sql.Subquery;
import com.eavstore.core.sql.Table;
import com.eavstore.core.value.AttrValue;
import com.eavstore.core.value.ValueCodec;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates an {@link EntityQuery} into a single SELECT over the EAV tables.
 *
 * The statement yields one row per (entity, attribute) pair with the columns
 * {@code attr, value, type, ent_key, ent_modified, ent_created}. Binary attribute
 * filters each join a fresh subquery of matching entity keys; existence filters add
 * correlated {@code EXISTS} predicates; entity filters compare entity columns directly.
 * Until a binary filter applies, the attribute table is outer-joined so entities
 * without attributes are returned too.
 */
public class EntityQueryCompiler {

    public static final String COL_ATTR = "attr";
    public static final String COL_VALUE = "value";
    public static final String COL_TYPE = "type";
    public static final String COL_ENT_KEY = "ent_key";
    public static final String COL_ENT_MODIFIED = "ent_modified";
    public static final String COL_ENT_CREATED = "ent_created";

    private final EavSchema schema;
    private final ValueCodec codec;

    public EntityQueryCompiler(EavSchema schema, ValueCodec codec) {
        this.schema = schema;
        this.codec = codec;
    }

    public CompiledStatement compile(EntityQuery query) {
        return SqlRenderer.render(toSelect(components(query)));
    }

    /**
     * Run every build step for the query, in order: base, attribute selection,
     * attribute filters, entity filters.
     */
    public QueryComponents components(EntityQuery query) {
        if (query == null) {
            query = EntityQuery.all();
        }
        QueryComponents components = base();
        if (!query.attrsToSelect().isEmpty()) {
            components = components.withAttrJoinCondition(
                components.outerAttrs().col(EavSchema.ATTR).in(query.attrsToSelect()));
        }
        for (AttrFilter filter : query.attrFilters()) {
            components = applyAttrFilter(components, filter);
        }
        for (EntFilter filter : query.entFilters()) {
            components = applyEntFilter(components, filter);
        }
        return components;
    }

    QueryComponents base() {
        Table outerEnts = schema.ents().alias("outer_ents");
        Table outerAttrs = schema.attrs().alias("outer_attrs");
        List<Selected> columns = List.of(
            outerAttrs.col(EavSchema.ATTR).as(COL_ATTR),
            outerAttrs.col(EavSchema.VALUE).as(COL_VALUE),
            outerAttrs.col(EavSchema.TYPE).as(COL_TYPE),
            outerEnts.col(EavSchema.KEY).as(COL_ENT_KEY),
            outerEnts.col(EavSchema.MODIFIED).as(COL_ENT_MODIFIED),
            outerEnts.col(EavSchema.CREATED).as(COL_ENT_CREATED));
        return new QueryComponents(outerEnts, outerAttrs, columns, List.of(), List.of(), List.of(), false, 0);
    }

    QueryComponents applyAttrFilter(QueryComponents components, AttrFilter filter) {
        FilterOp op = filter.parsedOp();
        return switch (op.type()) {
            case BINARY -> applyAttrBinaryFilter(components, filter, op);
            case EXISTENCE -> applyAttrExistenceFilter(components, filter, op);
        };
    }

    private QueryComponents applyAttrBinaryFilter(QueryComponents components, AttrFilter filter, FilterOp op) {
        components = components.nextAlias().requiringAttrRow();
        int n = components.aliasCount();
        Table attrs = schema.attrs().alias("filter_attrs_" + n);

        Condition comparison = comparison(attrs.col(EavSchema.VALUE), op, argText(filter.arg()));
        Subquery matches = Select.from(attrs, attrs.col(EavSchema.ENT_KEY).as(EavSchema.ENT_KEY))
            .asDistinct()
            .where(attrs.col(EavSchema.ATTR).eq(filter.attr()))
            .where(comparison)
            .as("binary_filter_" + n);

        Condition on = matches.col(EavSchema.ENT_KEY).eq(components.outerEnts().col(EavSchema.KEY));
        return components.withJoin(new Join(JoinType.INNER, matches, on));
    }

    // A predicate over the outer entity only: the base join stays outer
    private QueryComponents applyAttrExistenceFilter(QueryComponents components, AttrFilter filter, FilterOp op) {
        components = components.nextAlias();
        Table attrs = schema.attrs().alias("exists_attrs_" + components.aliasCount());

        Condition exists = Condition.exists(Select.from(attrs, attrs.col(EavSchema.ENT_KEY).as(EavSchema.ENT_KEY))
            .where(attrs.col(EavSchema.ATTR).eq(filter.attr()))
            .where(attrs.col(EavSchema.ENT_KEY).eq(components.outerEnts().col(EavSchema.KEY))));
        return components.withWhere(op.negated() ? exists.negate() : exists);
    }

    QueryComponents applyEntFilter(QueryComponents components, EntFilter filter) {
        FilterOp op = FilterOp.parse(filter.op());
        if (op.type() != FilterType.BINARY) {
            throw new UnknownFilterTypeException(
                "unknown filter type '" + filter.op() + "' for entity column " + filter.col());
        }
        Table ents = components.outerEnts();
        if (!ents.hasColumn(filter.col())) {
            throw new UnknownColumnException("Entity table has no column '" + filter.col() + "'");
        }
        Object arg = filter.arg() instanceof AttrValue v ? v.toJava() : filter.arg();
        return components.withWhere(comparison(ents.col(filter.col()), op, arg));
    }

    private static Condition comparison(ColumnRef column, FilterOp op, Object arg) {
        Condition clause = column.compare(op.op(), arg);
        return op.negated() ? clause.negate() : clause;
    }

    /**
     * Comparison argument in the same text form the value column holds.
     */
    private Object argText(AttrValue arg) {
        return codec.serialize(arg).text();
    }

    /**
     * One projection over the accumulated join graph with all predicates ANDed.
     */
    public Select toSelect(QueryComponents components) {
        Table outerEnts = components.outerEnts();
        Table outerAttrs = components.outerAttrs();

        List<Condition> attrJoin = new ArrayList<>();
        attrJoin.add(outerAttrs.col(EavSchema.ENT_KEY).eq(outerEnts.col(EavSchema.KEY)));
        attrJoin.addAll(components.attrJoinConditions());
        JoinType baseJoin = components.requiresAttrRow() ? JoinType.INNER : JoinType.LEFT_OUTER;

        Select select = Select.from(outerEnts, components.columns())
            .join(baseJoin, outerAttrs, Condition.and(attrJoin));
        for (Join join : components.joins()) {
            select = select.join(join.type(), join.item(), join.on());
        }
        for (Condition where : components.wheres()) {
            select = select.where(where);
        }
        return select;
    }
}
