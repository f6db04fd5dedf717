package com.embeddingstudio.vectordb.storage.config;

/**
 * Storage engines a {@link com.embeddingstudio.vectordb.storage.vectordb.VectorDb} can run on.
 */
public enum VectorDbBackend {
    ROCKSDB
}
