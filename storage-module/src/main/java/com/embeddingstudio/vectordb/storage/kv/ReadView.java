package com.embeddingstudio.vectordb.storage.kv;

import com.embeddingstudio.vectordb.common.exception.StorageException;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Snapshot;
import org.rocksdb.TransactionDB;

import java.util.List;

/**
 * Consistent read-only view of committed data. Takes no locks.
 */
public class ReadView implements AutoCloseable {

    private final TransactionDB db;
    private final Snapshot snapshot;
    private final ReadOptions readOptions;

    ReadView(TransactionDB db) {
        this.db = db;
        this.snapshot = db.getSnapshot();
        this.readOptions = new ReadOptions().setSnapshot(snapshot);
    }

    public byte[] get(ColumnFamilyHandle columnFamily, byte[] key) {
        try {
            return db.get(columnFamily, readOptions, key);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to read from storage", e);
        }
    }

    public List<KeyValue> scan(ColumnFamilyHandle columnFamily, byte[] prefix) {
        try (RocksIterator iterator = db.newIterator(columnFamily, readOptions)) {
            return KeyValue.scan(iterator, prefix);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to scan storage", e);
        }
    }

    public List<KeyValue> scanAll(ColumnFamilyHandle columnFamily) {
        return scan(columnFamily, new byte[0]);
    }

    @Override
    public void close() {
        readOptions.close();
        db.releaseSnapshot(snapshot);
    }
}
