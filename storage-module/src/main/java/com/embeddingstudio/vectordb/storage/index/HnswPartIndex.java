package com.embeddingstudio.vectordb.storage.index;

import com.embeddingstudio.vectordb.common.exception.StorageException;
import com.embeddingstudio.vectordb.common.model.MetricType;
import com.embeddingstudio.vectordb.common.model.SearchIndexInfo;
import com.github.jelmerk.hnswlib.core.DistanceFunction;
import com.github.jelmerk.hnswlib.core.DistanceFunctions;
import com.github.jelmerk.hnswlib.core.SearchResult;
import com.github.jelmerk.hnswlib.core.hnsw.HnswIndex;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory HNSW graph over the parts of one collection, built with the pure Java hnswlib.
 * The graph is derived data: every committed mutation marks it stale and the next search
 * rebuilds it from committed rows.
 */
@Slf4j
public class HnswPartIndex {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final String name;
    private final SearchIndexInfo searchIndex;
    private final int maxItems;
    private final int efSearch;

    /** Null until the first build */
    private HnswIndex<String, float[], PartItem, Float> hnswIndex;

    /** Bumped by every committed mutation */
    private long dataVersion;

    /** Data version the graph was built from */
    private long builtVersion = -1;

    public HnswPartIndex(String name, SearchIndexInfo searchIndex, int maxItems, int efSearch) {
        this.name = name;
        this.searchIndex = searchIndex;
        this.maxItems = maxItems;
        this.efSearch = efSearch;
    }

    public void markStale() {
        lock.writeLock().lock();
        try {
            dataVersion++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isStale() {
        lock.readLock().lock();
        try {
            return hnswIndex == null || builtVersion != dataVersion;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return hnswIndex == null ? 0 : hnswIndex.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Builds a fresh graph from the given parts. Mutations that happen while loading keep the graph stale.
     * The loader must read committed data through a snapshot taken after this call starts, since the
     * graph is stamped with the data version read before the loader runs.
     */
    public void rebuild(Supplier<List<PartItem>> loader) {
        long version;
        lock.readLock().lock();
        try {
            version = dataVersion;
        } finally {
            lock.readLock().unlock();
        }

        List<PartItem> items = loader.get();
        HnswIndex<String, float[], PartItem, Float> rebuilt = build(items);

        lock.writeLock().lock();
        try {
            if (version < builtVersion) {
                log.debug("Discarding HNSW build of {} at version {}, newer graph at {}", name, version, builtVersion);
                return;
            }
            hnswIndex = rebuilt;
            builtVersion = version;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Built HNSW index {} with {} parts, m={}, efConstruction={}",
                name, items.size(), searchIndex.hnsw().m(), searchIndex.hnsw().efConstruction());
    }

    /**
     * Approximate k nearest parts, closest first. Rebuilds the graph first when it is stale.
     */
    public List<PartMatch> findNearest(float[] queryVector, int k, Supplier<List<PartItem>> loader) {
        searchIndex.validateDimensions(queryVector);
        if (isStale()) {
            rebuild(loader);
        }

        lock.readLock().lock();
        try {
            int searchK = Math.min(k, hnswIndex.size());
            if (searchK <= 0) {
                return List.of();
            }
            log.debug("Performing HNSW search for k={} on {} indexed parts of {}", searchK, hnswIndex.size(), name);

            List<PartMatch> matches = new ArrayList<>(searchK);
            for (SearchResult<PartItem, Float> result : hnswIndex.findNearest(queryVector, searchK)) {
                PartItem item = result.item();
                matches.add(new PartMatch(item.objectId(), item.partId(), item.isAverage(), result.distance()));
            }
            return matches;
        } finally {
            lock.readLock().unlock();
        }
    }

    private HnswIndex<String, float[], PartItem, Float> build(List<PartItem> items) {
        HnswIndex<String, float[], PartItem, Float> index = HnswIndex
                .newBuilder(searchIndex.dimensions(), createDistanceFunction(searchIndex.metricType()),
                        Math.max(maxItems, items.size()))
                .withM(searchIndex.hnsw().m())
                .withEfConstruction(searchIndex.hnsw().efConstruction())
                .withEf(efSearch)
                .build();
        try {
            index.addAll(items);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while building HNSW index " + name, e);
        }
        return index;
    }

    static DistanceFunction<float[], Float> createDistanceFunction(MetricType metricType) {
        switch (metricType) {
            case DOT:
                return DistanceFunctions.FLOAT_INNER_PRODUCT;
            case EUCLID:
                return DistanceFunctions.FLOAT_EUCLIDEAN_DISTANCE;
            case COSINE:
            default:
                return DistanceFunctions.FLOAT_COSINE_DISTANCE;
        }
    }
}
