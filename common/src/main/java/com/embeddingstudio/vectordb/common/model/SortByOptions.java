package com.embeddingstudio.vectordb.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Caller-supplied ordering for payload searches. Objects missing the field sort last.
 */
public record SortByOptions(
    @NotBlank
    @JsonProperty("field")
    String field,

    @JsonProperty("order")
    SortOrder order,

    @JsonProperty("force_not_payload")
    boolean forceNotPayload
) {
    @JsonCreator
    public SortByOptions {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Sort field cannot be blank");
        }
        order = order == null ? SortOrder.ASC : order;
    }

    public static SortByOptions asc(String field) {
        return new SortByOptions(field, SortOrder.ASC, false);
    }

    public static SortByOptions desc(String field) {
        return new SortByOptions(field, SortOrder.DESC, false);
    }
}
