package com.embeddingstudio.vectordb.common.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Glob match with {@code *} and {@code ?} against the whole value or any of its tokens, case-insensitive.
 */
public record WildcardQuery(
    @JsonProperty("field")
    String field,

    @JsonProperty("value")
    String value,

    @JsonProperty("force_not_payload")
    boolean forceNotPayload
) implements PayloadFilter, FieldFilter {
    @JsonCreator
    public WildcardQuery {
        FilterArguments.requireField(field);
        if (value == null) {
            throw new IllegalArgumentException("WildcardQuery value cannot be null");
        }
    }

    public WildcardQuery(String field, String value) {
        this(field, value, false);
    }
}
