package com.embeddingstudio.vectordb.storage.vectordb;

import com.embeddingstudio.vectordb.common.exception.CollectionNotFoundException;
import com.embeddingstudio.vectordb.common.exception.CreateCollectionConflictException;
import com.embeddingstudio.vectordb.common.exception.DeleteBlueCollectionException;
import com.embeddingstudio.vectordb.common.model.CollectionInfo;
import com.embeddingstudio.vectordb.common.model.CollectionStateInfo;
import com.embeddingstudio.vectordb.common.model.EmbeddingModelInfo;
import com.embeddingstudio.vectordb.storage.collection.Collection;
import com.embeddingstudio.vectordb.storage.optimization.Optimization;

import java.util.List;
import java.util.Optional;

/**
 * Registry of the collections of one namespace and of its blue/green pointer.
 * A collection is named after its embedding model id; the paired query collection after
 * {@link #getQueryCollectionId(String)}.
 */
public interface VectorDb {

    String getDbId();

    List<CollectionStateInfo> listCollections();

    List<CollectionStateInfo> listQueryCollections();

    boolean collectionExists(String collectionId);

    boolean queryCollectionExists(String collectionId);

    /**
     * @throws CollectionNotFoundException when no such collection exists
     */
    Collection getCollection(String collectionId);

    /**
     * @param collectionId id of the query collection itself
     * @throws CollectionNotFoundException when no such query collection exists
     */
    Collection getQueryCollection(String collectionId);

    default String getQueryCollectionId(String embeddingModelId) {
        return embeddingModelId + "_q";
    }

    /**
     * Allocates storage, registers metadata and applies the registered optimizations.
     *
     * @throws CreateCollectionConflictException when the id is already bound to another model
     */
    Collection createCollection(EmbeddingModelInfo embeddingModel);

    Collection createQueryCollection(EmbeddingModelInfo embeddingModel);

    Collection getOrCreateCollection(EmbeddingModelInfo embeddingModel);

    Collection getOrCreateQueryCollection(EmbeddingModelInfo embeddingModel);

    Optional<Collection> getBlueCollection();

    Optional<Collection> getBlueQueryCollection();

    /**
     * Makes the model's collection and its query collection the blue pair.
     *
     * @throws CollectionNotFoundException when either collection is missing; the pointer is left unchanged
     */
    void setBlueCollection(String embeddingModelId);

    /**
     * @throws DeleteBlueCollectionException when the collection is blue
     */
    void deleteCollection(String collectionId);

    void deleteQueryCollection(String collectionId);

    void addOptimization(Optimization optimization);

    void addQueryOptimization(Optimization optimization);

    /** Runs every registered optimization not yet applied to each collection */
    void applyOptimizations();

    void applyQueryOptimizations();

    void saveCollectionInfo(CollectionInfo collectionInfo);
}
