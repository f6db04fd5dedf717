package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.storage.index.HnswPartIndex;

import java.util.function.LongSupplier;

/**
 * Process-local state of one collection shared by every handle to it: the HNSW graph and the insertion counter.
 */
public class CollectionRuntime {

    private final HnswPartIndex index;

    private long lastInsertSeq;
    private boolean seeded;

    public CollectionRuntime(HnswPartIndex index) {
        this.index = index;
    }

    public HnswPartIndex index() {
        return index;
    }

    /**
     * Next insertion sequence number. The counter starts after the largest stored one.
     */
    public synchronized long nextInsertSeq(LongSupplier storedMax) {
        if (!seeded) {
            lastInsertSeq = storedMax.getAsLong();
            seeded = true;
        }
        return ++lastInsertSeq;
    }
}
