package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.common.exception.DimensionMismatchException;
import com.embeddingstudio.vectordb.common.exception.DuplicateObjectException;
import com.embeddingstudio.vectordb.common.exception.LockAcquisitionException;
import com.embeddingstudio.vectordb.common.filter.PayloadFilter;
import com.embeddingstudio.vectordb.common.model.CollectionInfo;
import com.embeddingstudio.vectordb.common.model.CollectionStateInfo;
import com.embeddingstudio.vectordb.common.model.ObjectsCommonDataBatch;
import com.embeddingstudio.vectordb.common.model.SearchResults;
import com.embeddingstudio.vectordb.common.model.SimilaritySearchRequest;
import com.embeddingstudio.vectordb.common.model.SortByOptions;
import com.embeddingstudio.vectordb.common.model.VectorObject;

import java.util.List;

/**
 * Storage and search over the objects of one embedding model.
 * Every mutation is one all-or-nothing transaction holding row locks on exactly the touched ids.
 */
public interface Collection {

    CollectionStateInfo getStateInfo();

    CollectionInfo getInfo();

    /**
     * Takes exclusive row locks on the given ids, in sorted order, inside a fresh transaction.
     * Writes made through the returned lock become visible on {@link ObjectLock#commit()};
     * closing it without commit rolls them back and releases the locks.
     *
     * @throws LockAcquisitionException when a lock is still held by another transaction after the configured retries
     */
    ObjectLock lockObjects(List<String> objectIds);

    /**
     * @throws DuplicateObjectException when an id already exists or repeats within the batch
     * @throws DimensionMismatchException when a part vector has the wrong length; nothing is written
     */
    void insert(List<VectorObject> objects);

    /**
     * Writes or overwrites object rows.
     *
     * @param shrinkParts true to replace all parts of each object, false to merge parts by part id
     */
    void upsert(List<VectorObject> objects, boolean shrinkParts);

    default void upsert(List<VectorObject> objects) {
        upsert(objects, true);
    }

    /**
     * Deletes parts, then object rows. Unknown ids are ignored.
     */
    void delete(List<String> objectIds);

    /** Hydrated objects in request order; unknown ids are skipped */
    List<VectorObject> findByIds(List<String> objectIds);

    /** Personalized copies of the given canonical objects, in insertion order */
    List<VectorObject> findByOriginalIds(List<String> originalIds);

    List<VectorObject> findBySessionId(String sessionId);

    long getTotal(boolean originalsOnly);

    ObjectsCommonDataBatch getObjectsCommonDataBatch(int limit, int offset, boolean originalsOnly);

    /**
     * Builds the nearest-neighbour graph over current parts and records {@code indexCreated}. Idempotent.
     */
    void createIndex();

    SearchResults findSimilarities(SimilaritySearchRequest request);

    SearchResults findByPayloadFilter(PayloadFilter payloadFilter, int limit, int offset, SortByOptions sortBy,
                                      String userId);

    /** Number of canonical objects matching the filter */
    long countByPayloadFilter(PayloadFilter payloadFilter);
}
