package com.embeddingstudio.vectordb.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ObjectsCommonDataBatch(
    @JsonProperty("objects_info")
    List<ObjectCommonData> objects,

    @JsonProperty("total")
    long total,

    @JsonProperty("next_offset")
    Integer nextOffset
) {
    public ObjectsCommonDataBatch {
        objects = objects == null ? List.of() : List.copyOf(objects);
    }
}
