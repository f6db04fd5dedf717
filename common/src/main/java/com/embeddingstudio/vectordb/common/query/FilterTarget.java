package com.embeddingstudio.vectordb.common.query;

import com.embeddingstudio.vectordb.common.payload.PayloadValue;

import java.util.Optional;

/**
 * A stored object as seen by in-memory filter evaluation and sorting.
 */
public interface FilterTarget {

    Optional<PayloadValue> payloadValue(String key);

    Optional<String> columnValue(StoredColumn column);

    /**
     * Value of the field, empty when it is missing or null.
     */
    default Optional<PayloadValue> resolve(FieldRef field) {
        if (field.isPayload()) {
            return payloadValue(field.payloadKey()).filter(value -> !value.isNull());
        }
        return columnValue(field.column()).map(PayloadValue.StringValue::new);
    }
}
