package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.common.exception.StorageException;
import com.embeddingstudio.vectordb.common.serialization.JsonMappers;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON encoding of rows and the key layout of the object and part column families.
 * Part keys are {@code objectId NUL partId}, so the parts of one object form a contiguous key range.
 */
public class RowCodec {

    private static final char SEPARATOR = '\0';

    private final ObjectMapper objectMapper = JsonMappers.create();

    public byte[] objectKey(String objectId) {
        requireNoSeparator(objectId);
        return objectId.getBytes(StandardCharsets.UTF_8);
    }

    public byte[] partKey(String objectId, String partId) {
        requireNoSeparator(objectId);
        return (objectId + SEPARATOR + partId).getBytes(StandardCharsets.UTF_8);
    }

    public byte[] partPrefix(String objectId) {
        requireNoSeparator(objectId);
        return (objectId + SEPARATOR).getBytes(StandardCharsets.UTF_8);
    }

    public byte[] encode(Object row) {
        try {
            return objectMapper.writeValueAsBytes(row);
        } catch (IOException e) {
            throw new StorageException("Failed to encode " + row.getClass().getSimpleName(), e);
        }
    }

    public ObjectRow decodeObject(byte[] value) {
        return decode(value, ObjectRow.class);
    }

    public PartRow decodePart(byte[] value) {
        return decode(value, PartRow.class);
    }

    private <T> T decode(byte[] value, Class<T> type) {
        try {
            return objectMapper.readValue(value, type);
        } catch (IOException e) {
            throw new StorageException("Failed to decode " + type.getSimpleName(), e);
        }
    }

    private static void requireNoSeparator(String objectId) {
        if (objectId.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Object id cannot contain NUL characters");
        }
    }
}
