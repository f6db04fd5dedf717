package com.embeddingstudio.vectordb.storage.cache;

import com.embeddingstudio.vectordb.common.exception.CollectionNotFoundException;
import com.embeddingstudio.vectordb.common.exception.DuplicateKeyException;
import com.embeddingstudio.vectordb.common.model.BlueCollectionPointer;
import com.embeddingstudio.vectordb.common.model.CollectionInfo;
import com.embeddingstudio.vectordb.common.model.CollectionStateInfo;
import com.embeddingstudio.vectordb.common.model.CollectionWorkState;
import com.embeddingstudio.vectordb.storage.metadata.CollectionInfoRecord;
import com.embeddingstudio.vectordb.storage.metadata.CollectionMetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory view of one namespace's collection metadata and blue pointer.
 * Every mutation goes to the metadata store first and is followed by a full reload,
 * so a local write is never followed by a stale read.
 */
@Slf4j
public class CollectionInfoCache {

    private final CollectionMetadataStore metadataStore;
    private final String dbId;
    private final AtomicReference<CacheState> state = new AtomicReference<>(CacheState.EMPTY);

    public CollectionInfoCache(CollectionMetadataStore metadataStore, String dbId) {
        this.metadataStore = metadataStore;
        this.dbId = dbId;
        invalidateCache();
    }

    public String getDbId() {
        return dbId;
    }

    /**
     * Reloads every collection row and the blue pointer, then publishes the new state at once.
     */
    public void invalidateCache() {
        List<CollectionInfoRecord> records = metadataStore.findCollections(dbId);
        Optional<BlueCollectionPointer> pointer = metadataStore.findBluePointer(dbId);

        List<CollectionStateInfo> collections = new ArrayList<>();
        List<CollectionStateInfo> queryCollections = new ArrayList<>();
        CollectionStateInfo blue = null;
        CollectionStateInfo blueQuery = null;

        for (CollectionInfoRecord record : records) {
            if (record.containsQueries()) {
                boolean isBlue = pointer.map(p -> record.collectionId().equals(p.queryCollectionId())).orElse(false);
                CollectionStateInfo info = record.toStateInfo(isBlue ? CollectionWorkState.BLUE : CollectionWorkState.GREEN);
                queryCollections.add(info);
                if (isBlue) {
                    blueQuery = info;
                }
            } else {
                boolean isBlue = pointer.map(p -> record.collectionId().equals(p.collectionId())).orElse(false);
                CollectionStateInfo info = record.toStateInfo(isBlue ? CollectionWorkState.BLUE : CollectionWorkState.GREEN);
                collections.add(info);
                if (isBlue) {
                    blue = info;
                }
            }
        }

        state.set(new CacheState(List.copyOf(collections), List.copyOf(queryCollections), blue, blueQuery));
        log.debug("Reloaded collection cache for {}: {} collections, {} query collections, blue={}",
                dbId, collections.size(), queryCollections.size(), blue == null ? null : blue.collectionId());
    }

    public List<CollectionStateInfo> listCollections() {
        return state.get().collections();
    }

    public List<CollectionStateInfo> listQueryCollections() {
        return state.get().queryCollections();
    }

    /**
     * Looks the id up among both plain and query collections.
     */
    public Optional<CollectionStateInfo> getCollection(String collectionId) {
        CacheState current = state.get();
        return current.collections().stream()
                .filter(info -> info.collectionId().equals(collectionId))
                .findFirst()
                .or(() -> current.queryCollections().stream()
                        .filter(info -> info.collectionId().equals(collectionId))
                        .findFirst());
    }

    public Optional<CollectionStateInfo> getBlueCollection() {
        return Optional.ofNullable(state.get().blue());
    }

    public Optional<CollectionStateInfo> getBlueQueryCollection() {
        return Optional.ofNullable(state.get().blueQuery());
    }

    public CollectionStateInfo addCollection(CollectionInfo info) {
        return add(info, false);
    }

    public CollectionStateInfo addQueryCollection(CollectionInfo info) {
        return add(info, true);
    }

    private CollectionStateInfo add(CollectionInfo info, boolean containsQueries) {
        try {
            metadataStore.insertCollection(CollectionInfoRecord.newRecord(dbId, info, containsQueries));
        } catch (DuplicateKeyException e) {
            log.warn("Collection {} already exists in {}", info.collectionId(), dbId);
        }
        invalidateCache();
        return getCollection(info.collectionId())
                .orElseThrow(() -> new CollectionNotFoundException(info.collectionId()));
    }

    /**
     * Persists the embedding model and applied optimizations of an existing collection.
     */
    public void updateCollection(CollectionInfo info) {
        CollectionInfoRecord current = metadataStore.findCollection(dbId, info.collectionId())
                .orElseThrow(() -> new CollectionNotFoundException(info.collectionId()));
        metadataStore.updateCollection(current.toBuilder()
                .embeddingModel(info.embeddingModel())
                .appliedOptimizations(info.appliedOptimizations())
                .build());
        invalidateCache();
    }

    /**
     * Points the namespace at a new blue pair. Fails without writing when either collection is missing.
     */
    public void setBlueCollection(String collectionId, String queryCollectionId) {
        invalidateCache();
        CacheState current = state.get();
        boolean collectionExists = current.collections().stream()
                .anyMatch(info -> info.collectionId().equals(collectionId));
        if (!collectionExists) {
            throw new CollectionNotFoundException(collectionId);
        }
        if (queryCollectionId != null) {
            boolean queryCollectionExists = current.queryCollections().stream()
                    .anyMatch(info -> info.collectionId().equals(queryCollectionId));
            if (!queryCollectionExists) {
                throw new CollectionNotFoundException(queryCollectionId);
            }
        }

        metadataStore.switchBluePointer(new BlueCollectionPointer(dbId, collectionId, queryCollectionId));
        invalidateCache();
    }

    public void setIndexState(String collectionId, boolean created) {
        metadataStore.setIndexCreated(dbId, collectionId, created);
        invalidateCache();
    }

    public void deleteCollection(String collectionId) {
        try {
            if (!metadataStore.deleteCollection(dbId, collectionId)) {
                log.warn("Collection {} was already removed from {}", collectionId, dbId);
            }
        } finally {
            invalidateCache();
        }
    }

    private record CacheState(
        List<CollectionStateInfo> collections,
        List<CollectionStateInfo> queryCollections,
        CollectionStateInfo blue,
        CollectionStateInfo blueQuery
    ) {
        static final CacheState EMPTY = new CacheState(List.of(), List.of(), null, null);
    }
}
