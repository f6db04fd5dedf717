package com.embeddingstudio.vectordb.storage.index;

/**
 * Approximate nearest part returned by the graph. The distance is the graph's own and is only used for ranking.
 */
public record PartMatch(String objectId, String partId, boolean isAverage, float distance) {
}
