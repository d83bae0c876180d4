package com.eavstore.core.sql;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rendered SQL text with its positional parameters, in bind order.
 */
public record CompiledStatement(String sql, List<Object> params) {

    public CompiledStatement {
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    /**
     * Prepare the statement on a connection and bind all parameters.
     * Caller owns (and must close) the returned statement.
     */
    public PreparedStatement prepare(Connection conn) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        try {
            bind(stmt, params, 1);
            return stmt;
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }

    /**
     * Bind one row of values after the compiled parameters (used for INSERT batches).
     */
    public void bindRow(PreparedStatement stmt, List<?> row) throws SQLException {
        bind(stmt, row, params.size() + 1);
    }

    private static void bind(PreparedStatement stmt, List<?> values, int firstIndex) throws SQLException {
        int index = firstIndex;
        for (Object value : values) {
            stmt.setObject(index++, value);
        }
    }

    @Override
    public String toString() {
        return sql + " " + params;
    }
}
