package com.embeddingstudio.vectordb.storage.collection;

import java.util.List;

/**
 * @param parts    parts that were compared, closest first
 * @param distance aggregated object distance
 */
record ScoredObject(ObjectRow row, List<PartRow> parts, double distance) {
}
