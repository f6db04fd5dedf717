package com.embeddingstudio.vectordb.common.exception;

/**
 * Root of every failure raised by the vector database engine.
 */
public class VectorDbException extends RuntimeException {

    public VectorDbException(String message) {
        super(message);
    }

    public VectorDbException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same call later may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
