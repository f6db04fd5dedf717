package com.embeddingstudio.vectordb.common.model;

import com.embeddingstudio.vectordb.common.payload.Payload;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * One search hit. {@code distance} is absent for payload-only searches,
 * {@code vectors} is present only when the caller asked for them.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FoundObject(
    @JsonProperty("object_id")
    String objectId,

    @JsonProperty("original_id")
    String originalId,

    @JsonProperty("user_id")
    String userId,

    @JsonProperty("parts_found")
    int partsFound,

    @JsonProperty("payload")
    Payload payload,

    @JsonProperty("storage_meta")
    Payload storageMeta,

    @JsonProperty("distance")
    Double distance,

    @JsonProperty("part_ids")
    List<String> partIds,

    @JsonProperty("vectors")
    Map<String, float[]> vectors
) {
    public FoundObject {
        partIds = partIds == null ? List.of() : List.copyOf(partIds);
    }
}
