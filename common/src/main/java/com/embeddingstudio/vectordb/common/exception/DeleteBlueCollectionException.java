package com.embeddingstudio.vectordb.common.exception;

import lombok.Getter;

@Getter
public class DeleteBlueCollectionException extends VectorDbException {

    private final String collectionId;

    public DeleteBlueCollectionException(String collectionId) {
        super("Collection " + collectionId + " is the blue collection and cannot be deleted");
        this.collectionId = collectionId;
    }
}
