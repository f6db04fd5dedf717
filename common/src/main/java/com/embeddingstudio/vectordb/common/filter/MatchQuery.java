package com.embeddingstudio.vectordb.common.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Full-text match: every token of the value occurs in the field.
 */
public record MatchQuery(
    @JsonProperty("field")
    String field,

    @JsonProperty("value")
    String value,

    @JsonProperty("force_not_payload")
    boolean forceNotPayload
) implements PayloadFilter, FieldFilter {
    @JsonCreator
    public MatchQuery {
        FilterArguments.requireField(field);
        if (value == null) {
            throw new IllegalArgumentException("MatchQuery value cannot be null");
        }
    }

    public MatchQuery(String field, String value) {
        this(field, value, false);
    }
}
