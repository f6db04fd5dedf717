package com.embeddingstudio.vectordb.storage.vectordb;

import com.embeddingstudio.vectordb.common.exception.CollectionNotFoundException;
import com.embeddingstudio.vectordb.common.exception.CreateCollectionConflictException;
import com.embeddingstudio.vectordb.common.exception.DeleteBlueCollectionException;
import com.embeddingstudio.vectordb.common.model.CollectionInfo;
import com.embeddingstudio.vectordb.common.model.CollectionStateInfo;
import com.embeddingstudio.vectordb.common.model.EmbeddingModelInfo;
import com.embeddingstudio.vectordb.storage.cache.CollectionInfoCache;
import com.embeddingstudio.vectordb.storage.collection.Collection;
import com.embeddingstudio.vectordb.storage.collection.CollectionRuntime;
import com.embeddingstudio.vectordb.storage.collection.CollectionTables;
import com.embeddingstudio.vectordb.storage.collection.RocksDbCollection;
import com.embeddingstudio.vectordb.storage.collection.RowLocker;
import com.embeddingstudio.vectordb.storage.config.VectorDbProperties;
import com.embeddingstudio.vectordb.storage.index.HnswPartIndex;
import com.embeddingstudio.vectordb.storage.kv.RocksDbStore;
import com.embeddingstudio.vectordb.storage.metadata.CollectionMetadataStore;
import com.embeddingstudio.vectordb.storage.optimization.Optimization;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link VectorDb} over one shared {@link RocksDbStore}. Each namespace gets its own metadata cache;
 * collection handles are cheap and share one {@link CollectionRuntime} per collection.
 */
@Slf4j
public class RocksDbVectorDb implements VectorDb {

    private final RocksDbStore store;
    private final CollectionInfoCache cache;
    private final VectorDbProperties properties;
    private final RowLocker rowLocker;

    private final Map<String, CollectionRuntime> runtimes = new ConcurrentHashMap<>();
    private final List<Optimization> optimizations = new CopyOnWriteArrayList<>();
    private final List<Optimization> queryOptimizations = new CopyOnWriteArrayList<>();

    public RocksDbVectorDb(RocksDbStore store, CollectionMetadataStore metadataStore, String dbId,
                           VectorDbProperties properties) {
        this.store = store;
        this.cache = new CollectionInfoCache(metadataStore, dbId);
        this.properties = properties;
        this.rowLocker = new RowLocker(properties.getLocking().getMaxAttempts(),
                properties.getLocking().getRetryDelay());
        log.info("Vector DB {} opened with {} collections and {} query collections",
                dbId, cache.listCollections().size(), cache.listQueryCollections().size());
    }

    @Override
    public String getDbId() {
        return cache.getDbId();
    }

    @Override
    public List<CollectionStateInfo> listCollections() {
        return cache.listCollections();
    }

    @Override
    public List<CollectionStateInfo> listQueryCollections() {
        return cache.listQueryCollections();
    }

    @Override
    public boolean collectionExists(String collectionId) {
        return findIn(cache.listCollections(), collectionId).isPresent();
    }

    @Override
    public boolean queryCollectionExists(String collectionId) {
        return findIn(cache.listQueryCollections(), collectionId).isPresent();
    }

    @Override
    public Collection getCollection(String collectionId) {
        return findIn(cache.listCollections(), collectionId)
                .map(this::openCollection)
                .orElseThrow(() -> new CollectionNotFoundException(collectionId));
    }

    @Override
    public Collection getQueryCollection(String collectionId) {
        return findIn(cache.listQueryCollections(), collectionId)
                .map(this::openCollection)
                .orElseThrow(() -> new CollectionNotFoundException(collectionId));
    }

    @Override
    public Collection createCollection(EmbeddingModelInfo embeddingModel) {
        return create(CollectionInfo.forModel(embeddingModel), false);
    }

    @Override
    public Collection createQueryCollection(EmbeddingModelInfo embeddingModel) {
        String queryCollectionId = getQueryCollectionId(embeddingModel.id());
        return create(new CollectionInfo(queryCollectionId, embeddingModel, List.of()), true);
    }

    @Override
    public Collection getOrCreateCollection(EmbeddingModelInfo embeddingModel) {
        if (collectionExists(embeddingModel.id())) {
            return getCollection(embeddingModel.id());
        }
        return createCollection(embeddingModel);
    }

    @Override
    public Collection getOrCreateQueryCollection(EmbeddingModelInfo embeddingModel) {
        String queryCollectionId = getQueryCollectionId(embeddingModel.id());
        if (queryCollectionExists(queryCollectionId)) {
            return getQueryCollection(queryCollectionId);
        }
        return createQueryCollection(embeddingModel);
    }

    @Override
    public Optional<Collection> getBlueCollection() {
        return cache.getBlueCollection().map(this::openCollection);
    }

    @Override
    public Optional<Collection> getBlueQueryCollection() {
        return cache.getBlueQueryCollection().map(this::openCollection);
    }

    @Override
    public void setBlueCollection(String embeddingModelId) {
        cache.setBlueCollection(embeddingModelId, getQueryCollectionId(embeddingModelId));
        log.info("Collection {} is now blue in {}", embeddingModelId, getDbId());
    }

    @Override
    public void deleteCollection(String collectionId) {
        delete(collectionId, false);
    }

    @Override
    public void deleteQueryCollection(String collectionId) {
        delete(collectionId, true);
    }

    @Override
    public void addOptimization(Optimization optimization) {
        optimizations.add(optimization);
    }

    @Override
    public void addQueryOptimization(Optimization optimization) {
        queryOptimizations.add(optimization);
    }

    @Override
    public void applyOptimizations() {
        for (CollectionStateInfo info : cache.listCollections()) {
            applyOptimizations(openCollection(info), optimizations);
        }
    }

    @Override
    public void applyQueryOptimizations() {
        for (CollectionStateInfo info : cache.listQueryCollections()) {
            applyOptimizations(openCollection(info), queryOptimizations);
        }
    }

    @Override
    public void saveCollectionInfo(CollectionInfo collectionInfo) {
        cache.updateCollection(collectionInfo);
    }

    private Collection create(CollectionInfo info, boolean containsQueries) {
        EmbeddingModelInfo requested = info.embeddingModel();
        Optional<CollectionStateInfo> existing = cache.getCollection(info.collectionId());
        if (existing.isPresent() && !existing.get().embeddingModel().equals(requested)) {
            throw new CreateCollectionConflictException(requested, existing.get().embeddingModel());
        }

        CollectionTables.of(getDbId(), info.collectionId()).create(store);
        CollectionStateInfo stored = containsQueries ? cache.addQueryCollection(info) : cache.addCollection(info);
        if (!stored.embeddingModel().equals(requested)) {
            throw new CreateCollectionConflictException(requested, stored.embeddingModel());
        }
        log.info("Created {} {} in {}", containsQueries ? "query collection" : "collection",
                info.collectionId(), getDbId());

        Collection collection = openCollection(stored);
        applyOptimizations(collection, containsQueries ? queryOptimizations : optimizations);
        return collection;
    }

    private void delete(String collectionId, boolean queryCollection) {
        cache.invalidateCache();
        List<CollectionStateInfo> candidates = queryCollection ? cache.listQueryCollections() : cache.listCollections();
        CollectionStateInfo info = findIn(candidates, collectionId)
                .orElseThrow(() -> new CollectionNotFoundException(collectionId));
        if (info.isBlue()) {
            throw new DeleteBlueCollectionException(collectionId);
        }

        // re-checked under the pointer lock; tables go only after the row is gone
        cache.deleteCollection(collectionId);
        CollectionTables.of(getDbId(), collectionId).drop(store);
        runtimes.remove(collectionId);
        log.info("Deleted collection {} from {}", collectionId, getDbId());
    }

    private void applyOptimizations(Collection collection, List<Optimization> registered) {
        CollectionInfo info = collection.getInfo();
        List<String> applied = new ArrayList<>(info.appliedOptimizations());
        for (Optimization optimization : registered) {
            if (applied.contains(optimization.getName())) {
                continue;
            }
            log.info("Applying optimization {} to collection {}", optimization.getName(), info.collectionId());
            optimization.apply(collection);
            applied.add(optimization.getName());
            saveCollectionInfo(collection.getInfo().toBuilder().appliedOptimizations(applied).build());
        }
    }

    private Collection openCollection(CollectionStateInfo info) {
        CollectionRuntime runtime = runtimes.computeIfAbsent(info.collectionId(), id -> new CollectionRuntime(
                new HnswPartIndex(getDbId() + "/" + id, info.embeddingModel().searchIndex(),
                        properties.getIndex().getMaxItems(), properties.getIndex().getEfSearch())));
        return new RocksDbCollection(store, cache, info, runtime, rowLocker);
    }

    private static Optional<CollectionStateInfo> findIn(List<CollectionStateInfo> infos, String collectionId) {
        return infos.stream().filter(info -> info.collectionId().equals(collectionId)).findFirst();
    }
}
