package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.common.model.ObjectCommonData;
import com.embeddingstudio.vectordb.common.payload.Payload;
import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import com.embeddingstudio.vectordb.common.query.FilterTarget;
import com.embeddingstudio.vectordb.common.query.StoredColumn;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Optional;

/**
 * Stored object row. {@code insertSeq} records insertion order and survives upserts.
 */
@Builder
public record ObjectRow(
    @JsonProperty("object_id")
    String objectId,

    @JsonProperty("payload")
    Payload payload,

    @JsonProperty("storage_meta")
    Payload storageMeta,

    @JsonProperty("user_id")
    String userId,

    @JsonProperty("session_id")
    String sessionId,

    @JsonProperty("original_id")
    String originalId,

    @JsonProperty("insert_seq")
    long insertSeq
) implements FilterTarget {

    public ObjectRow {
        payload = payload == null ? Payload.empty() : payload;
        storageMeta = storageMeta == null ? Payload.empty() : storageMeta;
    }

    @Override
    public Optional<PayloadValue> payloadValue(String key) {
        return payload.get(key);
    }

    @Override
    public Optional<String> columnValue(StoredColumn column) {
        switch (column) {
            case OBJECT_ID:
                return Optional.of(objectId);
            case ORIGINAL_ID:
                return Optional.ofNullable(originalId);
            case USER_ID:
                return Optional.ofNullable(userId);
            case SESSION_ID:
                return Optional.ofNullable(sessionId);
            default:
                return Optional.empty();
        }
    }

    @JsonIgnore
    public boolean isCanonical() {
        return originalId == null;
    }

    public ObjectCommonData commonData() {
        return new ObjectCommonData(objectId, payload, storageMeta);
    }
}
