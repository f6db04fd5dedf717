package com.embeddingstudio.vectordb.common.model;

import com.embeddingstudio.vectordb.common.payload.Payload;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The storable unit of a collection: metadata plus one or more vector parts.
 * An object with {@code originalId} set is a personalized copy of that canonical object for {@code userId}.
 */
@Builder(toBuilder = true)
public record VectorObject(
    @NotBlank
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

    @NotEmpty
    @JsonProperty("parts")
    List<ObjectPart> parts
) {
    @JsonCreator
    public VectorObject {
        if (objectId == null || objectId.isBlank()) {
            throw new IllegalArgumentException("Object id cannot be blank");
        }
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("Object " + objectId + " must have at least one part");
        }
        payload = payload == null ? Payload.empty() : payload;
        storageMeta = storageMeta == null ? Payload.empty() : storageMeta;
        parts = List.copyOf(parts);
    }

    /**
     * Parts with every missing part id filled in. Fails when two parts end up with the same id.
     */
    public List<ObjectPart> resolvedParts() {
        List<ObjectPart> resolved = new ArrayList<>(parts.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < parts.size(); i++) {
            ObjectPart part = parts.get(i);
            ObjectPart withId = part.partId() == null ? part.withPartId(objectId + "_" + i) : part;
            if (!seen.add(withId.partId())) {
                throw new IllegalArgumentException(
                        "Duplicate part id " + withId.partId() + " in object " + objectId);
            }
            resolved.add(withId);
        }
        return resolved;
    }

    @JsonIgnore
    public boolean isPersonalized() {
        return originalId != null;
    }

    public ObjectCommonData commonData() {
        return new ObjectCommonData(objectId, payload, storageMeta);
    }
}
