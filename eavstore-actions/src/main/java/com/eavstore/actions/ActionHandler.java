package com.eavstore.actions;

import com.eavstore.core.model.Entity;
import com.eavstore.core.store.EntityOperations;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Applies one action's params to the entity API.
 */
@FunctionalInterface
public interface ActionHandler {
    Optional<Entity> apply(EntityOperations entities, ActionParams params) throws SQLException;
}
