package com.embeddingstudio.vectordb.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * Embedding model a collection is bound to. The model id doubles as the collection id.
 */
@Builder
public record EmbeddingModelInfo(
    @NotBlank
    @JsonProperty("name")
    String name,

    @NotBlank
    @JsonProperty("id")
    String id,

    @NotNull
    @JsonProperty("search_index_info")
    SearchIndexInfo searchIndex
) {
    @JsonCreator
    public EmbeddingModelInfo {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Embedding model id cannot be blank");
        }
        if (searchIndex == null) {
            throw new IllegalArgumentException("Search index info is required");
        }
    }

    @JsonIgnore
    public String fullName() {
        return name + ":" + id;
    }

    @JsonIgnore
    public int dimensions() {
        return searchIndex.dimensions();
    }

    /**
     * Same model under another id, used for the paired query collection.
     */
    public EmbeddingModelInfo withId(String newId) {
        return new EmbeddingModelInfo(name, newId, searchIndex);
    }
}
