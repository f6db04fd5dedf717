package com.embeddingstudio.vectordb.storage.vectordb;

import com.embeddingstudio.vectordb.storage.config.VectorDbBackend;
import com.embeddingstudio.vectordb.storage.config.VectorDbProperties;
import com.embeddingstudio.vectordb.storage.kv.RocksDbStore;
import com.embeddingstudio.vectordb.storage.metadata.CollectionMetadataStore;
import lombok.RequiredArgsConstructor;

/**
 * Opens a {@link VectorDb} namespace on the backend chosen in configuration.
 */
@RequiredArgsConstructor
public class VectorDbFactory {

    private final RocksDbStore store;
    private final CollectionMetadataStore metadataStore;
    private final VectorDbProperties properties;

    public VectorDb create(String dbId) {
        VectorDbBackend backend = properties.getBackend();
        switch (backend) {
            case ROCKSDB:
                return new RocksDbVectorDb(store, metadataStore, dbId, properties);
            default:
                throw new IllegalStateException("Unsupported vector DB backend: " + backend);
        }
    }
}
