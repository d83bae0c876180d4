package com.eavstore.core.value;

/**
 * A value that cannot be serialized for, or parsed back from, the attrs table.
 */
public class ValueCodecException extends RuntimeException {

    public ValueCodecException(String message) {
        super(message);
    }

    public ValueCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
