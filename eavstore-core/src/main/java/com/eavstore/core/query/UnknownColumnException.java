package com.eavstore.core.query;

/**
 * An entity filter naming a column the entity table does not have.
 */
public class UnknownColumnException extends IllegalArgumentException {

    public UnknownColumnException(String message) {
        super(message);
    }
}
