package com.embeddingstudio.vectordb.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import lombok.Builder;

@Builder
public record HnswParameters(
    @Min(2)
    @JsonProperty("m")
    int m,

    @Min(1)
    @JsonProperty("ef_construction")
    int efConstruction
) {
    public static final int DEFAULT_M = 16;
    public static final int DEFAULT_EF_CONSTRUCTION = 64;

    @JsonCreator
    public HnswParameters {
        if (m < 2) {
            throw new IllegalArgumentException("HNSW m must be at least 2");
        }
        if (efConstruction < 1) {
            throw new IllegalArgumentException("HNSW ef_construction must be positive");
        }
    }

    public static HnswParameters defaults() {
        return new HnswParameters(DEFAULT_M, DEFAULT_EF_CONSTRUCTION);
    }
}
