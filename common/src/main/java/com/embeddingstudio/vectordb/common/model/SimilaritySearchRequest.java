package com.embeddingstudio.vectordb.common.model;

import com.embeddingstudio.vectordb.common.filter.PayloadFilter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * Parameters of a similarity search.
 *
 * @param maxDistance     drop objects whose aggregated distance is greater than this
 * @param similarityFirst narrow to the nearest {@code candidateLimit} objects before filtering
 * @param candidateLimit  size of the nearest-neighbour pool, {@code offset + limit} when absent
 * @param averageOnly     compare against {@code is_average} parts only
 */
@Builder(toBuilder = true)
public record SimilaritySearchRequest(
    @NotNull
    @JsonProperty("query_vector")
    float[] queryVector,

    @Min(1)
    @JsonProperty("limit")
    int limit,

    @Min(0)
    @JsonProperty("offset")
    int offset,

    @JsonProperty("max_distance")
    Double maxDistance,

    @JsonProperty("payload_filter")
    PayloadFilter payloadFilter,

    @JsonProperty("sort_by")
    SortByOptions sortBy,

    @JsonProperty("user_id")
    String userId,

    @JsonProperty("similarity_first")
    boolean similarityFirst,

    @JsonProperty("with_vectors")
    boolean withVectors,

    @JsonProperty("average_only")
    boolean averageOnly,

    @JsonProperty("candidate_limit")
    Integer candidateLimit
) {
    @JsonCreator
    public SimilaritySearchRequest {
        if (queryVector == null || queryVector.length == 0) {
            throw new IllegalArgumentException("Query vector cannot be null or empty");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive, got: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative, got: " + offset);
        }
        if (candidateLimit != null && candidateLimit < 1) {
            throw new IllegalArgumentException("Candidate limit must be positive, got: " + candidateLimit);
        }
    }

    public static SimilaritySearchRequest of(float[] queryVector, int limit) {
        return SimilaritySearchRequest.builder().queryVector(queryVector).limit(limit).build();
    }

    public int effectiveCandidateLimit() {
        return candidateLimit != null ? candidateLimit : (int) Math.min(Integer.MAX_VALUE, (long) offset + limit);
    }
}
