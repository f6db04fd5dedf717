package com.embeddingstudio.vectordb.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Collection metadata as served by the metadata cache. {@code workState} is derived from the
 * blue pointer at load time and is never stored.
 */
@Builder(toBuilder = true)
public record CollectionStateInfo(
    @JsonProperty("collection_id")
    String collectionId,

    @JsonProperty("embedding_model")
    EmbeddingModelInfo embeddingModel,

    @JsonProperty("created_at")
    Instant createdAt,

    @JsonProperty("index_created")
    boolean indexCreated,

    @JsonProperty("work_state")
    CollectionWorkState workState,

    @JsonProperty("applied_optimizations")
    List<String> appliedOptimizations,

    @JsonProperty("contains_queries")
    boolean containsQueries
) {
    public CollectionStateInfo {
        workState = workState == null ? CollectionWorkState.GREEN : workState;
        appliedOptimizations = appliedOptimizations == null ? List.of() : List.copyOf(appliedOptimizations);
    }

    @JsonIgnore
    public boolean isBlue() {
        return workState == CollectionWorkState.BLUE;
    }

    public CollectionInfo toCollectionInfo() {
        return new CollectionInfo(collectionId, embeddingModel, appliedOptimizations);
    }
}
