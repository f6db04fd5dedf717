package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.common.exception.CollectionNotFoundException;
import com.embeddingstudio.vectordb.common.filter.PayloadFilter;
import com.embeddingstudio.vectordb.common.model.CollectionInfo;
import com.embeddingstudio.vectordb.common.model.CollectionStateInfo;
import com.embeddingstudio.vectordb.common.model.FoundObject;
import com.embeddingstudio.vectordb.common.model.ObjectCommonData;
import com.embeddingstudio.vectordb.common.model.ObjectsCommonDataBatch;
import com.embeddingstudio.vectordb.common.model.SearchIndexInfo;
import com.embeddingstudio.vectordb.common.model.SearchResults;
import com.embeddingstudio.vectordb.common.model.SimilaritySearchRequest;
import com.embeddingstudio.vectordb.common.model.SortByOptions;
import com.embeddingstudio.vectordb.common.model.VectorObject;
import com.embeddingstudio.vectordb.common.query.FilterTarget;
import com.embeddingstudio.vectordb.common.query.InMemoryFilterRenderer;
import com.embeddingstudio.vectordb.common.query.PayloadFilterCompiler;
import com.embeddingstudio.vectordb.storage.cache.CollectionInfoCache;
import com.embeddingstudio.vectordb.storage.index.PartItem;
import com.embeddingstudio.vectordb.storage.index.PartMatch;
import com.embeddingstudio.vectordb.storage.kv.KeyValue;
import com.embeddingstudio.vectordb.storage.kv.ReadView;
import com.embeddingstudio.vectordb.storage.kv.RocksDbStore;
import com.embeddingstudio.vectordb.storage.kv.StoreTransaction;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyHandle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Collection stored in two RocksDB column families: object rows keyed by object id and
 * part rows keyed by {@code objectId NUL partId}. Reads go through a snapshot and take no locks,
 * mutations run in pessimistic transactions with no-wait row locks.
 */
@Slf4j
public class RocksDbCollection implements Collection {

    private final RocksDbStore store;
    private final CollectionInfoCache cache;
    private final String collectionId;
    private final SearchIndexInfo searchIndex;
    private final CollectionTables tables;
    private final CollectionRuntime runtime;
    private final RowLocker rowLocker;

    private final RowCodec codec = new RowCodec();
    private final PayloadFilterCompiler filterCompiler = new PayloadFilterCompiler();
    private final InMemoryFilterRenderer filterRenderer = new InMemoryFilterRenderer();

    public RocksDbCollection(RocksDbStore store, CollectionInfoCache cache, CollectionStateInfo stateInfo,
                             CollectionRuntime runtime, RowLocker rowLocker) {
        this.store = store;
        this.cache = cache;
        this.collectionId = stateInfo.collectionId();
        this.searchIndex = stateInfo.embeddingModel().searchIndex();
        this.tables = CollectionTables.of(cache.getDbId(), collectionId);
        this.runtime = runtime;
        this.rowLocker = rowLocker;
    }

    @Override
    public CollectionStateInfo getStateInfo() {
        return cache.getCollection(collectionId)
                .orElseThrow(() -> new CollectionNotFoundException(collectionId));
    }

    @Override
    public CollectionInfo getInfo() {
        return getStateInfo().toCollectionInfo();
    }

    @Override
    public ObjectLock lockObjects(List<String> objectIds) {
        ColumnFamilyHandle objects = tables.objectsHandle(store);
        ColumnFamilyHandle parts = tables.partsHandle(store);
        StoreTransaction transaction = store.beginTransaction(Duration.ZERO);
        try {
            List<String> locked = rowLocker.lockAll(objectIds,
                    objectId -> transaction.tryLock(objects, codec.objectKey(objectId)));
            return new ObjectLock(transaction, locked, objects, parts, codec, searchIndex, runtime,
                    this::storedMaxInsertSeq);
        } catch (RuntimeException e) {
            transaction.close();
            throw e;
        }
    }

    @Override
    public void insert(List<VectorObject> objects) {
        if (objects.isEmpty()) {
            return;
        }
        ObjectLock.validate(objects, searchIndex);
        try (ObjectLock lock = lockObjects(objectIds(objects))) {
            lock.insert(objects);
            lock.commit();
        }
        log.debug("Inserted {} objects into {}", objects.size(), collectionId);
    }

    @Override
    public void upsert(List<VectorObject> objects, boolean shrinkParts) {
        if (objects.isEmpty()) {
            return;
        }
        ObjectLock.validate(objects, searchIndex);
        try (ObjectLock lock = lockObjects(objectIds(objects))) {
            lock.upsert(objects, shrinkParts);
            lock.commit();
        }
        log.debug("Upserted {} objects into {}, shrinkParts={}", objects.size(), collectionId, shrinkParts);
    }

    @Override
    public void delete(List<String> objectIds) {
        if (objectIds.isEmpty()) {
            return;
        }
        try (ObjectLock lock = lockObjects(objectIds)) {
            lock.delete(lock.objectIds());
            lock.commit();
        }
        log.debug("Deleted {} objects from {}", objectIds.size(), collectionId);
    }

    @Override
    public List<VectorObject> findByIds(List<String> objectIds) {
        ColumnFamilyHandle objects = tables.objectsHandle(store);
        List<VectorObject> found = new ArrayList<>();
        try (ReadView view = store.openReadView()) {
            for (String objectId : new LinkedHashSet<>(objectIds)) {
                byte[] value = view.get(objects, codec.objectKey(objectId));
                if (value != null) {
                    found.add(toVectorObject(codec.decodeObject(value), loadParts(view, objectId)));
                }
            }
        }
        return found;
    }

    @Override
    public List<VectorObject> findByOriginalIds(List<String> originalIds) {
        Set<String> wanted = Set.copyOf(originalIds);
        return findHydrated(row -> row.originalId() != null && wanted.contains(row.originalId()));
    }

    @Override
    public List<VectorObject> findBySessionId(String sessionId) {
        return findHydrated(row -> sessionId.equals(row.sessionId()));
    }

    @Override
    public long getTotal(boolean originalsOnly) {
        try (ReadView view = store.openReadView()) {
            return loadObjects(view).stream()
                    .filter(row -> !originalsOnly || row.isCanonical())
                    .count();
        }
    }

    @Override
    public ObjectsCommonDataBatch getObjectsCommonDataBatch(int limit, int offset, boolean originalsOnly) {
        requirePage(limit, offset);
        try (ReadView view = store.openReadView()) {
            List<ObjectRow> rows = loadObjects(view).stream()
                    .filter(row -> !originalsOnly || row.isCanonical())
                    .sorted(ResultOrdering.forRows(null))
                    .toList();
            List<ObjectCommonData> page = page(rows, offset, limit).stream()
                    .map(ObjectRow::commonData)
                    .toList();
            return new ObjectsCommonDataBatch(page, rows.size(), nextOffset(page.size(), offset, limit));
        }
    }

    @Override
    public void createIndex() {
        runtime.index().rebuild(this::loadCommittedPartItems);
        if (!getStateInfo().indexCreated()) {
            cache.setIndexState(collectionId, true);
        }
        log.info("Index created for collection {}", collectionId);
    }

    @Override
    public SearchResults findSimilarities(SimilaritySearchRequest request) {
        searchIndex.validateDimensions(request.queryVector());
        Predicate<FilterTarget> filter = filterRenderer.render(filterCompiler.compile(request.payloadFilter()));

        try (ReadView view = store.openReadView()) {
            List<ObjectRow> visible = ObjectVisibility.visibleTo(loadObjects(view), request.userId());

            List<ScoredObject> matched;
            if (request.similarityFirst()) {
                matched = nearestCandidates(view, visible, request).stream()
                        .filter(scored -> filter.test(scored.row()))
                        .collect(Collectors.toList());
            } else {
                Map<String, List<PartRow>> partsByObject = loadPartsByObject(view);
                matched = visible.stream()
                        .filter(filter)
                        .map(row -> score(row, partsByObject.getOrDefault(row.objectId(), List.of()), request))
                        .flatMap(Optional::stream)
                        .collect(Collectors.toList());
            }

            if (request.maxDistance() != null) {
                matched.removeIf(scored -> scored.distance() > request.maxDistance());
            }
            matched.sort(ResultOrdering.forScored(request.sortBy()));

            List<FoundObject> page = page(matched, request.offset(), request.limit()).stream()
                    .map(scored -> toFoundObject(scored.row(), scored.parts(), scored.distance(),
                            request.withVectors()))
                    .toList();
            log.debug("Similarity search in {} matched {} objects, similarityFirst={}",
                    collectionId, matched.size(), request.similarityFirst());
            return new SearchResults(page, nextOffset(page.size(), request.offset(), request.limit()),
                    matched.size());
        }
    }

    @Override
    public SearchResults findByPayloadFilter(PayloadFilter payloadFilter, int limit, int offset,
                                             SortByOptions sortBy, String userId) {
        requirePage(limit, offset);
        Predicate<FilterTarget> filter = filterRenderer.render(filterCompiler.compile(payloadFilter));

        try (ReadView view = store.openReadView()) {
            List<ObjectRow> matched = ObjectVisibility.visibleTo(loadObjects(view), userId).stream()
                    .filter(filter)
                    .sorted(ResultOrdering.forRows(sortBy))
                    .toList();
            List<FoundObject> page = page(matched, offset, limit).stream()
                    .map(row -> toFoundObject(row, loadParts(view, row.objectId()), null, false))
                    .toList();
            return new SearchResults(page, nextOffset(page.size(), offset, limit), matched.size());
        }
    }

    @Override
    public long countByPayloadFilter(PayloadFilter payloadFilter) {
        Predicate<FilterTarget> filter = filterRenderer.render(filterCompiler.compile(payloadFilter));
        try (ReadView view = store.openReadView()) {
            return loadObjects(view).stream()
                    .filter(ObjectRow::isCanonical)
                    .filter(filter)
                    .count();
        }
    }

    /**
     * The nearest {@code candidateLimit} visible objects, through the HNSW graph once the index
     * has been created, by exact scan before that.
     */
    private List<ScoredObject> nearestCandidates(ReadView view, List<ObjectRow> visible,
                                                 SimilaritySearchRequest request) {
        int pool = request.effectiveCandidateLimit();
        if (!getStateInfo().indexCreated()) {
            Map<String, List<PartRow>> partsByObject = loadPartsByObject(view);
            return visible.stream()
                    .map(row -> score(row, partsByObject.getOrDefault(row.objectId(), List.of()), request))
                    .flatMap(Optional::stream)
                    .sorted(ResultOrdering.forScored(null))
                    .limit(pool)
                    .collect(Collectors.toList());
        }

        Map<String, ObjectRow> visibleById = new HashMap<>();
        visible.forEach(row -> visibleById.put(row.objectId(), row));

        Set<String> candidates = new LinkedHashSet<>();
        int k = saturatedInt(4L * pool + 16);
        while (true) {
            List<PartMatch> matches = runtime.index()
                    .findNearest(request.queryVector(), k, this::loadCommittedPartItems);
            candidates.clear();
            for (PartMatch match : matches) {
                if (request.averageOnly() && !match.isAverage()) {
                    continue;
                }
                if (visibleById.containsKey(match.objectId())) {
                    candidates.add(match.objectId());
                    if (candidates.size() == pool) {
                        break;
                    }
                }
            }
            if (candidates.size() >= pool || matches.size() < k) {
                break;
            }
            k = saturatedInt(2L * k);
        }

        List<ScoredObject> scored = new ArrayList<>();
        for (String objectId : candidates) {
            score(visibleById.get(objectId), loadParts(view, objectId), request).ifPresent(scored::add);
        }
        return scored;
    }

    /**
     * Exact distance of every compared part, aggregated with the collection's aggregation.
     * Empty when the object has no part to compare.
     */
    private Optional<ScoredObject> score(ObjectRow row, List<PartRow> parts, SimilaritySearchRequest request) {
        List<Map.Entry<PartRow, Double>> distances = new ArrayList<>();
        for (PartRow part : parts) {
            if (request.averageOnly() && !part.isAverage()) {
                continue;
            }
            distances.add(Map.entry(part, searchIndex.distance(request.queryVector(), part.vector())));
        }
        if (distances.isEmpty()) {
            return Optional.empty();
        }
        distances.sort(Map.Entry.comparingByValue());
        double distance = searchIndex.metricAggregationType()
                .aggregate(distances.stream().map(Map.Entry::getValue).toList());
        List<PartRow> compared = distances.stream().map(Map.Entry::getKey).toList();
        return Optional.of(new ScoredObject(row, compared, distance));
    }

    private FoundObject toFoundObject(ObjectRow row, List<PartRow> parts, Double distance, boolean withVectors) {
        Map<String, float[]> vectors = null;
        if (withVectors) {
            vectors = new LinkedHashMap<>();
            for (PartRow part : parts) {
                vectors.put(part.partId(), part.vector());
            }
        }
        return FoundObject.builder()
                .objectId(row.objectId())
                .originalId(row.originalId())
                .userId(row.userId())
                .partsFound(parts.size())
                .payload(row.payload())
                .storageMeta(row.storageMeta())
                .distance(distance)
                .partIds(parts.stream().map(PartRow::partId).toList())
                .vectors(vectors)
                .build();
    }

    private VectorObject toVectorObject(ObjectRow row, List<PartRow> parts) {
        return VectorObject.builder()
                .objectId(row.objectId())
                .payload(row.payload())
                .storageMeta(row.storageMeta())
                .userId(row.userId())
                .sessionId(row.sessionId())
                .originalId(row.originalId())
                .parts(parts.stream().map(PartRow::toObjectPart).toList())
                .build();
    }

    private List<VectorObject> findHydrated(Predicate<ObjectRow> condition) {
        try (ReadView view = store.openReadView()) {
            return loadObjects(view).stream()
                    .filter(condition)
                    .sorted(ResultOrdering.forRows(null))
                    .map(row -> toVectorObject(row, loadParts(view, row.objectId())))
                    .toList();
        }
    }

    private List<ObjectRow> loadObjects(ReadView view) {
        ColumnFamilyHandle objects = tables.objectsHandle(store);
        return view.scanAll(objects).stream()
                .map(entry -> codec.decodeObject(entry.value()))
                .toList();
    }

    private List<PartRow> loadParts(ReadView view, String objectId) {
        ColumnFamilyHandle parts = tables.partsHandle(store);
        return view.scan(parts, codec.partPrefix(objectId)).stream()
                .map(entry -> codec.decodePart(entry.value()))
                .toList();
    }

    private Map<String, List<PartRow>> loadPartsByObject(ReadView view) {
        ColumnFamilyHandle parts = tables.partsHandle(store);
        Map<String, List<PartRow>> partsByObject = new HashMap<>();
        for (KeyValue entry : view.scanAll(parts)) {
            PartRow part = codec.decodePart(entry.value());
            partsByObject.computeIfAbsent(part.objectId(), id -> new ArrayList<>()).add(part);
        }
        return partsByObject;
    }

    private List<PartItem> loadPartItems(ReadView view) {
        ColumnFamilyHandle parts = tables.partsHandle(store);
        return view.scanAll(parts).stream()
                .map(entry -> codec.decodePart(entry.value()))
                .map(part -> PartItem.of(part.objectId(), part.partId(), part.vector(), part.isAverage()))
                .toList();
    }

    /** Reads through a snapshot of its own, taken when the index asks for it */
    private List<PartItem> loadCommittedPartItems() {
        try (ReadView view = store.openReadView()) {
            return loadPartItems(view);
        }
    }

    private long storedMaxInsertSeq() {
        try (ReadView view = store.openReadView()) {
            return loadObjects(view).stream().mapToLong(ObjectRow::insertSeq).max().orElse(0L);
        }
    }

    private static List<String> objectIds(List<VectorObject> objects) {
        return objects.stream().map(VectorObject::objectId).toList();
    }

    private static <T> List<T> page(List<T> items, int offset, int limit) {
        if (offset >= items.size()) {
            return List.of();
        }
        return items.subList(offset, (int) Math.min(items.size(), (long) offset + limit));
    }

    private static Integer nextOffset(int pageSize, int offset, int limit) {
        return pageSize == limit ? saturatedInt((long) offset + limit) : null;
    }

    private static int saturatedInt(long value) {
        return (int) Math.min(Integer.MAX_VALUE, value);
    }

    private static void requirePage(int limit, int offset) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive, got: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative, got: " + offset);
        }
    }
}
