package com.eavstore.core.value;

/**
 * Stored form of an attribute value: the type tag (null for plain strings)
 * and the text written to the value column.
 */
public record EncodedValue(String type, String text) {
}
