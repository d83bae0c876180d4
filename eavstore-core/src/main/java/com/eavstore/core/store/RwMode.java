package com.eavstore.core.store;

/**
 * Whether a raw SQL call commits its transaction.
 */
public enum RwMode {
    /** Roll back after executing, whatever the statement did. */
    READ,
    /** Commit after executing. */
    WRITE
}
