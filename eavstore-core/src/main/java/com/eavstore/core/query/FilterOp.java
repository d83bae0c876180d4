package com.eavstore.core.query;

import java.util.List;

/**
 * A filter operator split into its base operator and negation flag.
 *
 * Operators may carry the two-character prefix {@code "! "}: {@code "! LIKE"},
 * {@code "! EXISTS"}. Exactly that prefix is stripped; anything else is part of the
 * base operator.
 */
public record FilterOp(boolean negated, String op) {

    public static final String NEGATION_PREFIX = "! ";
    public static final List<String> BINARY_OPS = List.of("=", "<", ">", "<=", ">=", "LIKE");
    public static final String EXISTENCE_OP = "EXISTS";

    public static FilterOp parse(String raw) {
        if (raw == null) {
            throw new UnknownFilterTypeException("unknown filter type: missing op");
        }
        if (raw.startsWith(NEGATION_PREFIX)) {
            return new FilterOp(true, raw.substring(NEGATION_PREFIX.length()));
        }
        return new FilterOp(false, raw);
    }

    /**
     * Classify the base operator.
     *
     * @throws UnknownFilterTypeException if it is neither binary nor existence
     */
    public FilterType type() {
        if (BINARY_OPS.contains(op)) return FilterType.BINARY;
        if (EXISTENCE_OP.equals(op)) return FilterType.EXISTENCE;
        throw new UnknownFilterTypeException("unknown filter type '" + render() + "'");
    }

    public String render() {
        return negated ? NEGATION_PREFIX + op : op;
    }
}
