package com.embeddingstudio.vectordb.storage.optimization;

import com.embeddingstudio.vectordb.storage.collection.Collection;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the nearest-neighbour index of a collection that does not have one yet.
 */
@Slf4j
public class CreateIndexOptimization implements Optimization {

    public static final String NAME = "CreateIndexOptimization";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void apply(Collection collection) {
        if (collection.getStateInfo().indexCreated()) {
            log.debug("Collection {} already has an index", collection.getStateInfo().collectionId());
            return;
        }
        collection.createIndex();
    }
}
