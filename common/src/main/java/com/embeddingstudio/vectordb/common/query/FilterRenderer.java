package com.embeddingstudio.vectordb.common.query;

/**
 * Turns a compiled condition into something a storage backend can evaluate.
 *
 * @param <R> backend form of the condition
 */
public interface FilterRenderer<R> {

    R render(FilterCondition condition);
}
