package com.embeddingstudio.vectordb.storage.index;

import com.github.jelmerk.hnswlib.core.Item;

/**
 * One object part as an HNSW graph item. The id is unique across the collection.
 */
public record PartItem(
    String id,
    String objectId,
    String partId,
    float[] vector,
    boolean isAverage
) implements Item<String, float[]> {

    public static PartItem of(String objectId, String partId, float[] vector, boolean isAverage) {
        return new PartItem(objectId + '\0' + partId, objectId, partId, vector, isAverage);
    }

    @Override
    public int dimensions() {
        return vector.length;
    }
}
