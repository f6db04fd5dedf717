package com.embeddingstudio.vectordb.common.query;

import java.util.Arrays;

/**
 * Object columns a filter may address directly with {@code force_not_payload}.
 */
public enum StoredColumn {
    OBJECT_ID("object_id"),
    ORIGINAL_ID("original_id"),
    USER_ID("user_id"),
    SESSION_ID("session_id");

    private final String columnName;

    StoredColumn(String columnName) {
        this.columnName = columnName;
    }

    public String columnName() {
        return columnName;
    }

    public static StoredColumn fromName(String name) {
        return Arrays.stream(values())
                .filter(column -> column.columnName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown object column: " + name));
    }
}
