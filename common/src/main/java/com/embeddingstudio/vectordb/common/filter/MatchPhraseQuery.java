package com.embeddingstudio.vectordb.common.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Full-text phrase match: the value's tokens occur consecutively and in order.
 */
public record MatchPhraseQuery(
    @JsonProperty("field")
    String field,

    @JsonProperty("value")
    String value,

    @JsonProperty("force_not_payload")
    boolean forceNotPayload
) implements PayloadFilter, FieldFilter {
    @JsonCreator
    public MatchPhraseQuery {
        FilterArguments.requireField(field);
        if (value == null) {
            throw new IllegalArgumentException("MatchPhraseQuery value cannot be null");
        }
    }

    public MatchPhraseQuery(String field, String value) {
        this(field, value, false);
    }
}
