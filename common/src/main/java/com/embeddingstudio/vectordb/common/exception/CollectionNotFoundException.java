package com.embeddingstudio.vectordb.common.exception;

import lombok.Getter;

@Getter
public class CollectionNotFoundException extends VectorDbException {

    private final String collectionId;

    public CollectionNotFoundException(String collectionId) {
        super("Collection not found: " + collectionId);
        this.collectionId = collectionId;
    }
}
