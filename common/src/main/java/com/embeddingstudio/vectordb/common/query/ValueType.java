package com.embeddingstudio.vectordb.common.query;

import com.embeddingstudio.vectordb.common.payload.PayloadValue;

/**
 * How a comparison interprets the field value. {@code ANY} is used by operators without operands.
 */
public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    ANY;

    public static ValueType of(PayloadValue value) {
        if (value instanceof PayloadValue.NumberValue) {
            return NUMBER;
        }
        if (value instanceof PayloadValue.BoolValue) {
            return BOOLEAN;
        }
        if (value instanceof PayloadValue.StringValue) {
            return STRING;
        }
        throw new IllegalArgumentException("No comparison type for value: " + value);
    }
}
