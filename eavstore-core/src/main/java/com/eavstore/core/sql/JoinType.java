package com.eavstore.core.sql;

public enum JoinType {
    INNER("JOIN"),
    LEFT_OUTER("LEFT OUTER JOIN");

    private final String keyword;

    JoinType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
