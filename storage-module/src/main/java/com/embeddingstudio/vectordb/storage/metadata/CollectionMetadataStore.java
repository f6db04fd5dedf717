package com.embeddingstudio.vectordb.storage.metadata;

import com.embeddingstudio.vectordb.common.exception.CollectionNotFoundException;
import com.embeddingstudio.vectordb.common.exception.DeleteBlueCollectionException;
import com.embeddingstudio.vectordb.common.exception.DuplicateKeyException;
import com.embeddingstudio.vectordb.common.model.BlueCollectionPointer;

import java.util.List;
import java.util.Optional;

/**
 * Document store for collection metadata rows and the per-namespace blue pointer.
 */
public interface CollectionMetadataStore {

    /** All collection rows of the namespace, ordered by collection id */
    List<CollectionInfoRecord> findCollections(String dbId);

    Optional<CollectionInfoRecord> findCollection(String dbId, String collectionId);

    /**
     * @throws DuplicateKeyException when a row with the same key already exists
     */
    void insertCollection(CollectionInfoRecord record);

    /**
     * Replaces the mutable fields of an existing row.
     *
     * @throws CollectionNotFoundException when the row does not exist
     */
    void updateCollection(CollectionInfoRecord record);

    void setIndexCreated(String dbId, String collectionId, boolean created);

    /**
     * Removes the row while holding the blue pointer's lock, so no switch can name it meanwhile.
     *
     * @return false when there was no such row
     * @throws DeleteBlueCollectionException when the blue pointer names the collection; nothing is removed
     */
    boolean deleteCollection(String dbId, String collectionId);

    Optional<BlueCollectionPointer> findBluePointer(String dbId);

    /**
     * Writes the blue pointer after checking, under the pointer's row lock, that every collection it
     * names exists. Concurrent switches of one namespace are serialized.
     *
     * @throws CollectionNotFoundException when a referenced collection is missing; nothing is written
     */
    void switchBluePointer(BlueCollectionPointer pointer);
}
