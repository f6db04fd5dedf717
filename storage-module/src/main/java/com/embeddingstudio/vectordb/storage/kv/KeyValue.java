package com.embeddingstudio.vectordb.storage.kv;

import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;

import java.util.ArrayList;
import java.util.List;

/**
 * One stored entry returned by a prefix scan.
 */
public record KeyValue(byte[] key, byte[] value) {

    static List<KeyValue> scan(RocksIterator iterator, byte[] prefix) throws RocksDBException {
        List<KeyValue> entries = new ArrayList<>();
        if (prefix.length == 0) {
            iterator.seekToFirst();
        } else {
            iterator.seek(prefix);
        }

        while (iterator.isValid()) {
            byte[] key = iterator.key();
            if (!startsWith(key, prefix)) {
                break;
            }
            entries.add(new KeyValue(key, iterator.value()));
            iterator.next();
        }
        iterator.status();
        return entries;
    }

    static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
