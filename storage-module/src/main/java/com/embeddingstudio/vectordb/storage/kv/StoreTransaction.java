package com.embeddingstudio.vectordb.storage.kv;

import com.embeddingstudio.vectordb.common.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Transaction;
import org.rocksdb.TransactionOptions;
import org.rocksdb.WriteOptions;

import java.util.List;

/**
 * Pessimistic RocksDB transaction. Closing it without {@link #commit()} rolls back every write
 * and releases every row lock it holds.
 */
@Slf4j
public class StoreTransaction implements AutoCloseable {

    private final Transaction transaction;
    private final WriteOptions writeOptions;
    private final TransactionOptions transactionOptions;
    private final ReadOptions readOptions = new ReadOptions();
    private boolean finished;

    StoreTransaction(Transaction transaction, WriteOptions writeOptions, TransactionOptions transactionOptions) {
        this.transaction = transaction;
        this.writeOptions = writeOptions;
        this.transactionOptions = transactionOptions;
    }

    /**
     * Takes an exclusive lock on the key, whether or not it exists.
     *
     * @return false when another transaction holds the lock
     */
    public boolean tryLock(ColumnFamilyHandle columnFamily, byte[] key) {
        try {
            transaction.getForUpdate(readOptions, columnFamily, key, true);
            return true;
        } catch (RocksDBException e) {
            if (LockConflicts.isLockConflict(e)) {
                return false;
            }
            throw new StorageException("Failed to lock row", e);
        }
    }

    public byte[] get(ColumnFamilyHandle columnFamily, byte[] key) {
        try {
            return transaction.get(columnFamily, readOptions, key);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to read row", e);
        }
    }

    /**
     * Prefix scan that also sees this transaction's own uncommitted writes.
     */
    public List<KeyValue> scan(ColumnFamilyHandle columnFamily, byte[] prefix) {
        try (RocksIterator iterator = transaction.getIterator(readOptions, columnFamily)) {
            return KeyValue.scan(iterator, prefix);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to scan rows", e);
        }
    }

    public void put(ColumnFamilyHandle columnFamily, byte[] key, byte[] value) {
        try {
            transaction.put(columnFamily, key, value);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to write row", e);
        }
    }

    public void delete(ColumnFamilyHandle columnFamily, byte[] key) {
        try {
            transaction.delete(columnFamily, key);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to delete row", e);
        }
    }

    public void commit() {
        try {
            transaction.commit();
            finished = true;
        } catch (RocksDBException e) {
            throw new StorageException("Failed to commit transaction", e);
        }
    }

    public void rollback() {
        if (finished) {
            return;
        }
        try {
            transaction.rollback();
        } catch (RocksDBException e) {
            throw new StorageException("Failed to roll back transaction", e);
        } finally {
            finished = true;
        }
    }

    @Override
    public void close() {
        try {
            rollback();
        } finally {
            transaction.close();
            readOptions.close();
            writeOptions.close();
            transactionOptions.close();
        }
    }
}
