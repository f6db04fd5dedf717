package com.embeddingstudio.vectordb.common.filter;

import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Exact equality. Numbers and booleans compare by value, strings by text.
 */
public record TermQuery(
    @JsonProperty("field")
    String field,

    @JsonProperty("value")
    PayloadValue value,

    @JsonProperty("force_not_payload")
    boolean forceNotPayload
) implements PayloadFilter, FieldFilter {
    @JsonCreator
    public TermQuery {
        FilterArguments.requireField(field);
        FilterArguments.requireScalar(value);
    }

    public TermQuery(String field, Object value) {
        this(field, PayloadValue.of(value), false);
    }
}
