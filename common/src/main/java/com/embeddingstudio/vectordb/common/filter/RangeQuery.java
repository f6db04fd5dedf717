package com.embeddingstudio.vectordb.common.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Numeric bounds on a field. All present bounds must hold; with no bound the query matches everything.
 */
public record RangeQuery(
    @JsonProperty("field")
    String field,

    @JsonProperty("range")
    RangeCondition range,

    @JsonProperty("force_not_payload")
    boolean forceNotPayload
) implements PayloadFilter, FieldFilter {
    @JsonCreator
    public RangeQuery {
        FilterArguments.requireField(field);
        range = range == null ? RangeCondition.builder().build() : range;
    }

    public RangeQuery(String field, RangeCondition range) {
        this(field, range, false);
    }
}
