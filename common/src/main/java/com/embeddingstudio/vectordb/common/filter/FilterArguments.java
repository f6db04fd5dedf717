package com.embeddingstudio.vectordb.common.filter;

import com.embeddingstudio.vectordb.common.payload.PayloadValue;

final class FilterArguments {

    private FilterArguments() {
    }

    static void requireField(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Filter field cannot be blank");
        }
    }

    static void requireScalar(PayloadValue value) {
        if (!(value instanceof PayloadValue.StringValue
                || value instanceof PayloadValue.NumberValue
                || value instanceof PayloadValue.BoolValue)) {
            throw new IllegalArgumentException("Term values must be strings, numbers or booleans, got: " + value);
        }
    }
}
