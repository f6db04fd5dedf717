package com.embeddingstudio.vectordb.common.exception;

/**
 * Unique key conflict in the collection metadata store.
 */
public class DuplicateKeyException extends VectorDbException {

    public DuplicateKeyException(String key) {
        super("Duplicate metadata key: " + key);
    }
}
