package com.eavstore.core.sql;

public record Join(JoinType type, FromItem item, Condition on) {
}
