package com.eavstore.core.store;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;

/**
 * Classifies driver exceptions.
 */
final class SqlErrors {

    // SQLITE_CONSTRAINT primary result code
    private static final int SQLITE_CONSTRAINT = 19;

    private SqlErrors() {
    }

    /**
     * True if the exception reports a primary key or unique constraint violation.
     * Foreign key, NOT NULL and CHECK violations are not uniqueness violations.
     */
    static boolean isUniqueViolation(SQLException e) {
        if (e instanceof SQLiteException sqlite) {
            SQLiteErrorCode code = sqlite.getResultCode();
            if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY || code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE) {
                return true;
            }
            if (code != SQLiteErrorCode.SQLITE_CONSTRAINT) {
                return false;
            }
        }
        if (e.getErrorCode() == SQLITE_CONSTRAINT && e.getMessage() != null) {
            String message = e.getMessage();
            return message.contains("UNIQUE constraint failed") || message.contains("PRIMARY KEY");
        }
        // SQLSTATE 23505 is unique_violation; other class 23 states are other integrity errors
        return "23505".equals(e.getSQLState())
            || (e instanceof SQLIntegrityConstraintViolationException && e.getMessage() != null
                && e.getMessage().toLowerCase().contains("unique"));
    }
}
