package com.embeddingstudio.vectordb.common.filter;

import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Equality with any of the listed values. An empty list matches nothing.
 */
public record TermsQuery(
    @JsonProperty("field")
    String field,

    @JsonProperty("values")
    List<PayloadValue> values,

    @JsonProperty("force_not_payload")
    boolean forceNotPayload
) implements PayloadFilter, FieldFilter {
    @JsonCreator
    public TermsQuery {
        FilterArguments.requireField(field);
        values = values == null ? List.of() : List.copyOf(values);
        values.forEach(FilterArguments::requireScalar);
    }

    public static TermsQuery of(String field, Object... values) {
        return new TermsQuery(field, Arrays.stream(values).map(PayloadValue::of).toList(), false);
    }
}
