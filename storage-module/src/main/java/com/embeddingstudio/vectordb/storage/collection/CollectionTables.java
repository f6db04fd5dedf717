package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.storage.kv.RocksDbStore;
import org.rocksdb.ColumnFamilyHandle;

/**
 * Column family names of one collection's object and part tables.
 */
public record CollectionTables(String objects, String parts) {

    public static CollectionTables of(String dbId, String collectionId) {
        return new CollectionTables("dbo_" + dbId + "_" + collectionId, "dbop_" + dbId + "_" + collectionId);
    }

    public void create(RocksDbStore store) {
        store.createColumnFamily(objects);
        store.createColumnFamily(parts);
    }

    /** Drops parts first, then objects */
    public void drop(RocksDbStore store) {
        store.dropColumnFamily(parts);
        store.dropColumnFamily(objects);
    }

    ColumnFamilyHandle objectsHandle(RocksDbStore store) {
        return store.columnFamily(objects);
    }

    ColumnFamilyHandle partsHandle(RocksDbStore store) {
        return store.columnFamily(parts);
    }
}
