package com.embeddingstudio.vectordb.common.exception;

import lombok.Getter;

import java.util.List;

/**
 * Row locks could not be obtained within the configured number of attempts.
 * The operation that raised it wrote nothing and may be retried.
 */
@Getter
public class LockAcquisitionException extends VectorDbException {

    private final List<String> objectIds;

    public LockAcquisitionException(String message, List<String> objectIds) {
        super(message);
        this.objectIds = List.copyOf(objectIds);
    }

    public LockAcquisitionException(String message, List<String> objectIds, Throwable cause) {
        super(message, cause);
        this.objectIds = List.copyOf(objectIds);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
