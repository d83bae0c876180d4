package com.eavstore.core.query;

/**
 * How a filter constrains the query: a value comparison or an attribute presence test.
 */
public enum FilterType {
    BINARY,
    EXISTENCE
}
