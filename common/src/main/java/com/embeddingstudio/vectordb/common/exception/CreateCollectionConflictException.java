package com.embeddingstudio.vectordb.common.exception;

import com.embeddingstudio.vectordb.common.model.EmbeddingModelInfo;
import lombok.Getter;

/**
 * A collection with the same id already exists but was created for a different embedding model.
 */
@Getter
public class CreateCollectionConflictException extends VectorDbException {

    private final EmbeddingModelInfo requested;
    private final EmbeddingModelInfo existing;

    public CreateCollectionConflictException(EmbeddingModelInfo requested, EmbeddingModelInfo existing) {
        super(String.format("Collection %s already exists with a different model: requested %s, existing %s",
                requested.id(), requested, existing));
        this.requested = requested;
        this.existing = existing;
    }
}
