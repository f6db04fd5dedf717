package com.embeddingstudio.vectordb.common.exception;

import lombok.Getter;

@Getter
public class DuplicateObjectException extends VectorDbException {

    private final String objectId;

    public DuplicateObjectException(String objectId) {
        super("Object already exists: " + objectId);
        this.objectId = objectId;
    }
}
