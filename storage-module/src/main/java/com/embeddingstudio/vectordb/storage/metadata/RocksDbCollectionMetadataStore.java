package com.embeddingstudio.vectordb.storage.metadata;

import com.embeddingstudio.vectordb.common.exception.CollectionNotFoundException;
import com.embeddingstudio.vectordb.common.exception.DeleteBlueCollectionException;
import com.embeddingstudio.vectordb.common.exception.DuplicateKeyException;
import com.embeddingstudio.vectordb.common.exception.LockAcquisitionException;
import com.embeddingstudio.vectordb.common.exception.StorageException;
import com.embeddingstudio.vectordb.common.model.BlueCollectionPointer;
import com.embeddingstudio.vectordb.common.serialization.JsonMappers;
import com.embeddingstudio.vectordb.storage.kv.KeyValue;
import com.embeddingstudio.vectordb.storage.kv.ReadView;
import com.embeddingstudio.vectordb.storage.kv.RocksDbStore;
import com.embeddingstudio.vectordb.storage.kv.StoreTransaction;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyHandle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Metadata rows in two dedicated column families of the shared RocksDB instance.
 */
@Slf4j
public class RocksDbCollectionMetadataStore implements CollectionMetadataStore {

    static final String COLLECTION_INFO_CF = "vectordb_collection_info";
    static final String BLUE_COLLECTION_ID_CF = "vectordb_blue_collection_id";

    private static final char KEY_SEPARATOR = '/';

    private final RocksDbStore store;
    private final Duration lockTimeout;
    private final ObjectMapper objectMapper = JsonMappers.create();
    private final ColumnFamilyHandle collectionInfo;
    private final ColumnFamilyHandle blueCollectionId;

    /**
     * @param lockTimeout bound on waiting for a metadata row held by another writer
     */
    public RocksDbCollectionMetadataStore(RocksDbStore store, Duration lockTimeout) {
        this.store = store;
        this.lockTimeout = lockTimeout;
        this.collectionInfo = store.createColumnFamily(COLLECTION_INFO_CF);
        this.blueCollectionId = store.createColumnFamily(BLUE_COLLECTION_ID_CF);
    }

    @Override
    public List<CollectionInfoRecord> findCollections(String dbId) {
        List<CollectionInfoRecord> records = new ArrayList<>();
        try (ReadView view = store.openReadView()) {
            for (KeyValue entry : view.scan(collectionInfo, keyPrefix(dbId))) {
                records.add(decode(entry.value(), CollectionInfoRecord.class));
            }
        }
        return records;
    }

    @Override
    public Optional<CollectionInfoRecord> findCollection(String dbId, String collectionId) {
        try (ReadView view = store.openReadView()) {
            byte[] value = view.get(collectionInfo, collectionKey(dbId, collectionId));
            return value == null ? Optional.empty() : Optional.of(decode(value, CollectionInfoRecord.class));
        }
    }

    @Override
    public void insertCollection(CollectionInfoRecord record) {
        byte[] key = collectionKey(record.dbId(), record.collectionId());
        try (StoreTransaction transaction = store.beginTransaction(lockTimeout)) {
            lock(transaction, collectionInfo, key, record.collectionId());
            if (transaction.get(collectionInfo, key) != null) {
                throw new DuplicateKeyException(record.dbId() + KEY_SEPARATOR + record.collectionId());
            }
            transaction.put(collectionInfo, key, encode(record));
            transaction.commit();
        }
        log.debug("Inserted metadata for collection {} in {}", record.collectionId(), record.dbId());
    }

    @Override
    public void updateCollection(CollectionInfoRecord record) {
        byte[] key = collectionKey(record.dbId(), record.collectionId());
        try (StoreTransaction transaction = store.beginTransaction(lockTimeout)) {
            lock(transaction, collectionInfo, key, record.collectionId());
            byte[] existing = transaction.get(collectionInfo, key);
            if (existing == null) {
                throw new CollectionNotFoundException(record.collectionId());
            }
            CollectionInfoRecord current = decode(existing, CollectionInfoRecord.class);
            CollectionInfoRecord updated = current.toBuilder()
                    .embeddingModel(record.embeddingModel())
                    .appliedOptimizations(record.appliedOptimizations())
                    .build();
            transaction.put(collectionInfo, key, encode(updated));
            transaction.commit();
        }
    }

    @Override
    public void setIndexCreated(String dbId, String collectionId, boolean created) {
        byte[] key = collectionKey(dbId, collectionId);
        try (StoreTransaction transaction = store.beginTransaction(lockTimeout)) {
            lock(transaction, collectionInfo, key, collectionId);
            byte[] existing = transaction.get(collectionInfo, key);
            if (existing == null) {
                throw new CollectionNotFoundException(collectionId);
            }
            CollectionInfoRecord current = decode(existing, CollectionInfoRecord.class);
            transaction.put(collectionInfo, key, encode(current.toBuilder().indexCreated(created).build()));
            transaction.commit();
        }
    }

    @Override
    public boolean deleteCollection(String dbId, String collectionId) {
        byte[] pointerKey = dbId.getBytes(StandardCharsets.UTF_8);
        byte[] key = collectionKey(dbId, collectionId);
        try (StoreTransaction transaction = store.beginTransaction(lockTimeout)) {
            // pointer row first, in the same order as switchBluePointer
            lock(transaction, blueCollectionId, pointerKey, collectionId);
            lock(transaction, collectionInfo, key, collectionId);
            byte[] pointerValue = transaction.get(blueCollectionId, pointerKey);
            if (pointerValue != null && names(decode(pointerValue, BlueCollectionPointer.class), collectionId)) {
                throw new DeleteBlueCollectionException(collectionId);
            }
            if (transaction.get(collectionInfo, key) == null) {
                return false;
            }
            transaction.delete(collectionInfo, key);
            transaction.commit();
            return true;
        }
    }

    @Override
    public Optional<BlueCollectionPointer> findBluePointer(String dbId) {
        try (ReadView view = store.openReadView()) {
            byte[] value = view.get(blueCollectionId, dbId.getBytes(StandardCharsets.UTF_8));
            return value == null ? Optional.empty() : Optional.of(decode(value, BlueCollectionPointer.class));
        }
    }

    @Override
    public void switchBluePointer(BlueCollectionPointer pointer) {
        byte[] pointerKey = pointer.dbId().getBytes(StandardCharsets.UTF_8);
        try (StoreTransaction transaction = store.beginTransaction(lockTimeout)) {
            lock(transaction, blueCollectionId, pointerKey, pointer.collectionId());
            requireCollection(transaction, pointer.dbId(), pointer.collectionId());
            if (pointer.queryCollectionId() != null) {
                requireCollection(transaction, pointer.dbId(), pointer.queryCollectionId());
            }
            transaction.put(blueCollectionId, pointerKey, encode(pointer));
            transaction.commit();
        }
        log.info("Blue collection of {} switched to {} (query collection {})",
                pointer.dbId(), pointer.collectionId(), pointer.queryCollectionId());
    }

    private static boolean names(BlueCollectionPointer pointer, String collectionId) {
        return collectionId.equals(pointer.collectionId()) || collectionId.equals(pointer.queryCollectionId());
    }

    private void requireCollection(StoreTransaction transaction, String dbId, String collectionId) {
        byte[] key = collectionKey(dbId, collectionId);
        // shared with deleteCollection, so a collection cannot disappear before the pointer commits
        lock(transaction, collectionInfo, key, collectionId);
        if (transaction.get(collectionInfo, key) == null) {
            throw new CollectionNotFoundException(collectionId);
        }
    }

    private void lock(StoreTransaction transaction, ColumnFamilyHandle columnFamily, byte[] key, String id) {
        if (!transaction.tryLock(columnFamily, key)) {
            throw new LockAcquisitionException(
                    "Metadata row " + id + " is locked by another writer for more than " + lockTimeout, List.of(id));
        }
    }

    private static byte[] keyPrefix(String dbId) {
        if (dbId.indexOf(KEY_SEPARATOR) >= 0) {
            throw new IllegalArgumentException("db_id cannot contain '" + KEY_SEPARATOR + "': " + dbId);
        }
        return (dbId + KEY_SEPARATOR).getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] collectionKey(String dbId, String collectionId) {
        byte[] prefix = keyPrefix(dbId);
        byte[] id = collectionId.getBytes(StandardCharsets.UTF_8);
        byte[] key = new byte[prefix.length + id.length];
        System.arraycopy(prefix, 0, key, 0, prefix.length);
        System.arraycopy(id, 0, key, prefix.length, id.length);
        return key;
    }

    private byte[] encode(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new StorageException("Failed to encode metadata", e);
        }
    }

    private <T> T decode(byte[] value, Class<T> type) {
        try {
            return objectMapper.readValue(value, type);
        } catch (IOException e) {
            throw new StorageException("Failed to decode metadata", e);
        }
    }
}
