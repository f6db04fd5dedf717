package com.embeddingstudio.vectordb.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record CollectionInfo(
    @NotBlank
    @JsonProperty("collection_id")
    String collectionId,

    @NotNull
    @JsonProperty("embedding_model")
    EmbeddingModelInfo embeddingModel,

    @JsonProperty("applied_optimizations")
    List<String> appliedOptimizations
) {
    @JsonCreator
    public CollectionInfo {
        if (collectionId == null || collectionId.isBlank()) {
            throw new IllegalArgumentException("Collection id cannot be blank");
        }
        if (embeddingModel == null) {
            throw new IllegalArgumentException("Embedding model is required");
        }
        appliedOptimizations = appliedOptimizations == null ? List.of() : List.copyOf(appliedOptimizations);
    }

    public static CollectionInfo forModel(EmbeddingModelInfo model) {
        return new CollectionInfo(model.id(), model, List.of());
    }
}
