package com.embeddingstudio.vectordb.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * The single per-namespace record naming the blue collection and its paired query collection.
 */
public record BlueCollectionPointer(
    @NotBlank
    @JsonProperty("db_id")
    String dbId,

    @NotBlank
    @JsonProperty("collection_id")
    String collectionId,

    @JsonProperty("query_collection_id")
    String queryCollectionId
) {
    @JsonCreator
    public BlueCollectionPointer {
        if (dbId == null || dbId.isBlank()) {
            throw new IllegalArgumentException("db_id cannot be blank");
        }
        if (collectionId == null || collectionId.isBlank()) {
            throw new IllegalArgumentException("collection_id cannot be blank");
        }
    }
}
