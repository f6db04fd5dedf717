package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.common.model.ObjectPart;
import com.fasterxml.jackson.annotation.JsonProperty;

public record PartRow(
    @JsonProperty("object_id")
    String objectId,

    @JsonProperty("part_id")
    String partId,

    @JsonProperty("vector")
    float[] vector,

    @JsonProperty("is_average")
    boolean isAverage,

    @JsonProperty("user_id")
    String userId
) {
    public ObjectPart toObjectPart() {
        return new ObjectPart(partId, vector, isAverage);
    }
}
