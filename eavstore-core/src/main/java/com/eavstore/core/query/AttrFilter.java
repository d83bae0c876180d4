package com.eavstore.core.query;

import com.eavstore.core.value.AttrValue;

import java.util.Objects;

/**
 * Attribute-level predicate. Binary filters compare the stored value of {@code attr}
 * against {@code arg}; existence filters ignore {@code arg}.
 */
public record AttrFilter(String attr, String op, AttrValue arg) {

    public AttrFilter {
        Objects.requireNonNull(attr, "attr");
        Objects.requireNonNull(op, "op");
    }

    public static AttrFilter binary(String attr, String op, Object arg) {
        return new AttrFilter(attr, op, AttrValue.from(arg));
    }

    public static AttrFilter eq(String attr, Object arg) {
        return binary(attr, "=", arg);
    }

    public static AttrFilter exists(String attr) {
        return new AttrFilter(attr, FilterOp.EXISTENCE_OP, null);
    }

    public static AttrFilter notExists(String attr) {
        return new AttrFilter(attr, FilterOp.NEGATION_PREFIX + FilterOp.EXISTENCE_OP, null);
    }

    public FilterOp parsedOp() {
        return FilterOp.parse(op);
    }
}
