package com.embeddingstudio.vectordb.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

/**
 * One vector representation of an object, usually one content chunk.
 * A missing part id is assigned as {@code <objectId>_<index>} when the object is stored.
 */
@Builder
public record ObjectPart(
    @JsonProperty("part_id")
    String partId,

    @NotNull
    @Size(min = 1)
    @JsonProperty("vector")
    float[] vector,

    @JsonProperty("is_average")
    boolean isAverage
) {
    @JsonCreator
    public ObjectPart {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Part vector cannot be null or empty");
        }
    }

    public static ObjectPart of(String partId, float... vector) {
        return new ObjectPart(partId, vector, false);
    }

    public ObjectPart withPartId(String newPartId) {
        return new ObjectPart(newPartId, vector, isAverage);
    }
}
