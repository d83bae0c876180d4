package com.eavstore.core.query;

/**
 * A filter operator that is neither a comparison nor {@code EXISTS}.
 * Raised while compiling, before any statement reaches the store.
 */
public class UnknownFilterTypeException extends IllegalArgumentException {

    public UnknownFilterTypeException(String message) {
        super(message);
    }
}
