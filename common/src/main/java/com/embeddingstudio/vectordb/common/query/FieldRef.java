package com.embeddingstudio.vectordb.common.query;

import com.embeddingstudio.vectordb.common.filter.FieldFilter;

/**
 * Either a payload key or a stored column. Exactly one of {@code payloadKey} and {@code column} is set.
 */
public record FieldRef(String payloadKey, StoredColumn column) {

    public FieldRef {
        if ((payloadKey == null) == (column == null)) {
            throw new IllegalArgumentException("Field must name either a payload key or a column");
        }
    }

    public static FieldRef payload(String key) {
        return new FieldRef(key, null);
    }

    public static FieldRef column(StoredColumn column) {
        return new FieldRef(null, column);
    }

    public static FieldRef of(String field, boolean forceNotPayload) {
        return forceNotPayload ? column(StoredColumn.fromName(field)) : payload(field);
    }

    public static FieldRef of(FieldFilter filter) {
        return of(filter.field(), filter.forceNotPayload());
    }

    public boolean isPayload() {
        return payloadKey != null;
    }

    @Override
    public String toString() {
        return isPayload() ? "payload." + payloadKey : column.columnName();
    }
}
