package com.embeddingstudio.vectordb.common.exception;

public class StorageException extends VectorDbException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
