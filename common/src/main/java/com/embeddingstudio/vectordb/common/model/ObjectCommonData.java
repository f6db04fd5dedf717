package com.embeddingstudio.vectordb.common.model;

import com.embeddingstudio.vectordb.common.payload.Payload;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata-only view of an object, used by reindex listings.
 */
public record ObjectCommonData(
    @JsonProperty("object_id")
    String objectId,

    @JsonProperty("payload")
    Payload payload,

    @JsonProperty("storage_meta")
    Payload storageMeta
) {
}
