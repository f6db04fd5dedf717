package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.common.exception.DuplicateObjectException;
import com.embeddingstudio.vectordb.common.model.ObjectPart;
import com.embeddingstudio.vectordb.common.model.SearchIndexInfo;
import com.embeddingstudio.vectordb.common.model.VectorObject;
import com.embeddingstudio.vectordb.storage.kv.KeyValue;
import com.embeddingstudio.vectordb.storage.kv.StoreTransaction;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyHandle;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Transaction scope holding exclusive row locks on a set of object ids.
 * Writes are restricted to the locked ids and stay invisible until {@link #commit()}.
 */
@Slf4j
public class ObjectLock implements AutoCloseable {

    private final StoreTransaction transaction;
    private final List<String> objectIds;
    private final Set<String> lockedIds;
    private final ColumnFamilyHandle objects;
    private final ColumnFamilyHandle parts;
    private final RowCodec codec;
    private final SearchIndexInfo searchIndex;
    private final CollectionRuntime runtime;
    private final LongSupplier storedMaxInsertSeq;

    private boolean dirty;

    ObjectLock(StoreTransaction transaction, List<String> objectIds, ColumnFamilyHandle objects,
               ColumnFamilyHandle parts, RowCodec codec, SearchIndexInfo searchIndex, CollectionRuntime runtime,
               LongSupplier storedMaxInsertSeq) {
        this.transaction = transaction;
        this.objectIds = List.copyOf(objectIds);
        this.lockedIds = Set.copyOf(objectIds);
        this.objects = objects;
        this.parts = parts;
        this.codec = codec;
        this.searchIndex = searchIndex;
        this.runtime = runtime;
        this.storedMaxInsertSeq = storedMaxInsertSeq;
    }

    /** Locked ids in lock order */
    public List<String> objectIds() {
        return objectIds;
    }

    /**
     * Checks part ids and vector dimensions of every object before anything is written.
     */
    static void validate(List<VectorObject> batch, SearchIndexInfo searchIndex) {
        for (VectorObject object : batch) {
            for (ObjectPart part : object.resolvedParts()) {
                searchIndex.validateDimensions(part.vector());
            }
        }
    }

    public void insert(List<VectorObject> batch) {
        validate(batch, searchIndex);
        Set<String> seen = new HashSet<>();
        for (VectorObject object : batch) {
            requireLocked(object.objectId());
            if (!seen.add(object.objectId())
                    || transaction.get(objects, codec.objectKey(object.objectId())) != null) {
                throw new DuplicateObjectException(object.objectId());
            }
        }
        for (VectorObject object : batch) {
            writeObject(object, nextInsertSeq());
            writeParts(object);
        }
        dirty = true;
    }

    /**
     * @param shrinkParts true to delete every stored part of the object first
     */
    public void upsert(List<VectorObject> batch, boolean shrinkParts) {
        validate(batch, searchIndex);
        Map<String, VectorObject> lastById = new LinkedHashMap<>();
        for (VectorObject object : batch) {
            requireLocked(object.objectId());
            lastById.remove(object.objectId());
            lastById.put(object.objectId(), object);
        }

        for (VectorObject object : lastById.values()) {
            byte[] existing = transaction.get(objects, codec.objectKey(object.objectId()));
            long insertSeq = existing != null ? codec.decodeObject(existing).insertSeq() : nextInsertSeq();
            if (existing != null && shrinkParts) {
                deleteParts(object.objectId());
            }
            writeObject(object, insertSeq);
            writeParts(object);
        }
        dirty = true;
    }

    /**
     * Deletes part rows, then object rows. Unknown ids are ignored.
     */
    public void delete(List<String> ids) {
        ids.forEach(this::requireLocked);
        for (String objectId : ids) {
            deleteParts(objectId);
        }
        for (String objectId : ids) {
            transaction.delete(objects, codec.objectKey(objectId));
        }
        dirty = true;
    }

    public void commit() {
        transaction.commit();
        if (dirty) {
            runtime.index().markStale();
        }
        log.debug("Committed changes to objects {}", objectIds);
    }

    /**
     * Rolls back anything not committed and releases the locks.
     */
    @Override
    public void close() {
        transaction.close();
    }

    private long nextInsertSeq() {
        return runtime.nextInsertSeq(storedMaxInsertSeq);
    }

    private void writeObject(VectorObject object, long insertSeq) {
        ObjectRow row = ObjectRow.builder()
                .objectId(object.objectId())
                .payload(object.payload())
                .storageMeta(object.storageMeta())
                .userId(object.userId())
                .sessionId(object.sessionId())
                .originalId(object.originalId())
                .insertSeq(insertSeq)
                .build();
        transaction.put(objects, codec.objectKey(object.objectId()), codec.encode(row));
    }

    private void writeParts(VectorObject object) {
        for (ObjectPart part : object.resolvedParts()) {
            PartRow row = new PartRow(object.objectId(), part.partId(), part.vector(), part.isAverage(),
                    object.userId());
            transaction.put(parts, codec.partKey(object.objectId(), part.partId()), codec.encode(row));
        }
    }

    private void deleteParts(String objectId) {
        for (KeyValue entry : transaction.scan(parts, codec.partPrefix(objectId))) {
            transaction.delete(parts, entry.key());
        }
    }

    private void requireLocked(String objectId) {
        if (!lockedIds.contains(objectId)) {
            throw new IllegalStateException("Object " + objectId + " is not locked by this transaction");
        }
    }
}
