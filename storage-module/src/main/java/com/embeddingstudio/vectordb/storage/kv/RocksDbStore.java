package com.embeddingstudio.vectordb.storage.kv;

import com.embeddingstudio.vectordb.common.exception.StorageException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.TransactionDB;
import org.rocksdb.TransactionDBOptions;
import org.rocksdb.TransactionOptions;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transactional RocksDB instance shared by all namespaces. Every collection and metadata table
 * lives in its own column family, created and dropped at runtime.
 */
@Slf4j
public class RocksDbStore implements AutoCloseable {

    private final String dataPath;

    private TransactionDB db;
    private DBOptions dbOptions;
    private TransactionDBOptions transactionDbOptions;
    private ColumnFamilyOptions columnFamilyOptions;
    private final Map<String, ColumnFamilyHandle> columnFamilyHandles = new ConcurrentHashMap<>();

    public RocksDbStore(String dataPath) {
        this.dataPath = dataPath;
    }

    @PostConstruct
    public synchronized void initialize() {
        if (db != null) {
            return;
        }
        RocksDB.loadLibrary();

        try {
            Path dbPath = Paths.get(dataPath);
            Files.createDirectories(dbPath);

            columnFamilyOptions = new ColumnFamilyOptions();
            List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
            for (byte[] name : existingColumnFamilies(dbPath)) {
                descriptors.add(new ColumnFamilyDescriptor(name, columnFamilyOptions));
            }

            dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
            transactionDbOptions = new TransactionDBOptions();

            List<ColumnFamilyHandle> handles = new ArrayList<>();
            db = TransactionDB.open(dbOptions, transactionDbOptions, dbPath.toString(), descriptors, handles);

            for (int i = 0; i < descriptors.size(); i++) {
                columnFamilyHandles.put(new String(descriptors.get(i).getName(), StandardCharsets.UTF_8), handles.get(i));
            }

            log.info("RocksDB initialized at path: {} with {} column families", dbPath, handles.size());

        } catch (RocksDBException | IOException e) {
            log.error("Failed to initialize RocksDB at {}", dataPath, e);
            throw new StorageException("Failed to initialize storage", e);
        }
    }

    private List<byte[]> existingColumnFamilies(Path dbPath) throws RocksDBException {
        if (!Files.exists(dbPath.resolve("CURRENT"))) {
            return List.of(RocksDB.DEFAULT_COLUMN_FAMILY);
        }
        try (Options options = new Options()) {
            return RocksDB.listColumnFamilies(options, dbPath.toString());
        }
    }

    public boolean hasColumnFamily(String name) {
        return columnFamilyHandles.containsKey(name);
    }

    public Set<String> columnFamilyNames() {
        return Set.copyOf(columnFamilyHandles.keySet());
    }

    public ColumnFamilyHandle columnFamily(String name) {
        ColumnFamilyHandle handle = columnFamilyHandles.get(name);
        if (handle == null) {
            throw new StorageException("Column family does not exist: " + name);
        }
        return handle;
    }

    /**
     * Creates the column family unless it already exists.
     */
    public synchronized ColumnFamilyHandle createColumnFamily(String name) {
        ColumnFamilyHandle existing = columnFamilyHandles.get(name);
        if (existing != null) {
            return existing;
        }
        try {
            ColumnFamilyHandle handle = db.createColumnFamily(
                new ColumnFamilyDescriptor(name.getBytes(StandardCharsets.UTF_8), columnFamilyOptions));
            columnFamilyHandles.put(name, handle);
            log.info("Created column family {}", name);
            return handle;
        } catch (RocksDBException e) {
            log.error("Failed to create column family {}", name, e);
            throw new StorageException("Failed to create column family " + name, e);
        }
    }

    /**
     * Drops the column family and all of its data. Missing families are ignored.
     */
    public synchronized void dropColumnFamily(String name) {
        ColumnFamilyHandle handle = columnFamilyHandles.remove(name);
        if (handle == null) {
            return;
        }
        try {
            db.dropColumnFamily(handle);
            log.info("Dropped column family {}", name);
        } catch (RocksDBException e) {
            log.error("Failed to drop column family {}", name, e);
            throw new StorageException("Failed to drop column family " + name, e);
        } finally {
            handle.close();
        }
    }

    /**
     * @param lockTimeout how long {@link StoreTransaction#tryLock} waits for a held row lock, zero for no wait
     */
    public StoreTransaction beginTransaction(Duration lockTimeout) {
        WriteOptions writeOptions = new WriteOptions();
        TransactionOptions transactionOptions = new TransactionOptions().setLockTimeout(lockTimeout.toMillis());
        return new StoreTransaction(db.beginTransaction(writeOptions, transactionOptions), writeOptions,
            transactionOptions);
    }

    public ReadView openReadView() {
        return new ReadView(db);
    }

    @PreDestroy
    @Override
    public synchronized void close() {
        if (db == null) {
            return;
        }
        columnFamilyHandles.values().forEach(ColumnFamilyHandle::close);
        columnFamilyHandles.clear();
        db.close();
        db = null;
        dbOptions.close();
        transactionDbOptions.close();
        columnFamilyOptions.close();
        log.info("RocksDB closed successfully");
    }
}
