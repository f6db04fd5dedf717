package com.embeddingstudio.vectordb.storage.metadata;

import com.embeddingstudio.vectordb.common.model.CollectionInfo;
import com.embeddingstudio.vectordb.common.model.CollectionStateInfo;
import com.embeddingstudio.vectordb.common.model.CollectionWorkState;
import com.embeddingstudio.vectordb.common.model.EmbeddingModelInfo;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Persisted metadata document of one collection, keyed by {@code (dbId, collectionId)}.
 */
@Builder(toBuilder = true)
public record CollectionInfoRecord(
    @JsonProperty("db_id")
    String dbId,

    @JsonProperty("collection_id")
    String collectionId,

    @JsonProperty("embedding_model")
    EmbeddingModelInfo embeddingModel,

    @JsonProperty("created_at")
    Instant createdAt,

    @JsonProperty("index_created")
    boolean indexCreated,

    @JsonProperty("contains_queries")
    boolean containsQueries,

    @JsonProperty("applied_optimizations")
    List<String> appliedOptimizations
) {
    public CollectionInfoRecord {
        appliedOptimizations = appliedOptimizations == null ? List.of() : List.copyOf(appliedOptimizations);
    }

    public static CollectionInfoRecord newRecord(String dbId, CollectionInfo info, boolean containsQueries) {
        return new CollectionInfoRecord(dbId, info.collectionId(), info.embeddingModel(), Instant.now(), false,
                containsQueries, info.appliedOptimizations());
    }

    public CollectionStateInfo toStateInfo(CollectionWorkState workState) {
        return CollectionStateInfo.builder()
                .collectionId(collectionId)
                .embeddingModel(embeddingModel)
                .createdAt(createdAt)
                .indexCreated(indexCreated)
                .workState(workState)
                .appliedOptimizations(appliedOptimizations)
                .containsQueries(containsQueries)
                .build();
    }
}
