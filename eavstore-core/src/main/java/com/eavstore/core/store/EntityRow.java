package com.eavstore.core.store;

import com.eavstore.core.query.EntityQueryCompiler;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * One row of a compiled entity query: an attribute of an entity, or an entity
 * with no attribute row ({@code attr} null) when the attribute table was outer-joined.
 */
public record EntityRow(String attr, String value, String type, String entKey, long entModified, long entCreated) {

    static EntityRow read(ResultSet rs) throws SQLException {
        return new EntityRow(
            rs.getString(EntityQueryCompiler.COL_ATTR),
            rs.getString(EntityQueryCompiler.COL_VALUE),
            rs.getString(EntityQueryCompiler.COL_TYPE),
            rs.getString(EntityQueryCompiler.COL_ENT_KEY),
            rs.getLong(EntityQueryCompiler.COL_ENT_MODIFIED),
            rs.getLong(EntityQueryCompiler.COL_ENT_CREATED));
    }
}
