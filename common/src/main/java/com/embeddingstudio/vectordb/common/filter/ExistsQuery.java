package com.embeddingstudio.vectordb.common.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ExistsQuery(
    @JsonProperty("field")
    String field,

    @JsonProperty("force_not_payload")
    boolean forceNotPayload
) implements PayloadFilter, FieldFilter {
    @JsonCreator
    public ExistsQuery {
        FilterArguments.requireField(field);
    }

    public ExistsQuery(String field) {
        this(field, false);
    }
}
