package com.embeddingstudio.vectordb.storage.optimization;

import com.embeddingstudio.vectordb.storage.collection.Collection;

/**
 * Named one-time maintenance step for a collection. Names of applied optimizations are stored
 * with the collection so each one runs at most once per collection.
 */
public interface Optimization {

    String getName();

    void apply(Collection collection);
}
