package com.embeddingstudio.vectordb.storage.collection;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Which rows a search caller may see. A user's personalized copy shadows the canonical object it customizes.
 */
final class ObjectVisibility {

    private ObjectVisibility() {
    }

    static List<ObjectRow> visibleTo(List<ObjectRow> rows, String userId) {
        if (userId == null) {
            return rows.stream().filter(row -> row.userId() == null).toList();
        }
        Set<String> shadowed = rows.stream()
                .filter(row -> userId.equals(row.userId()) && row.originalId() != null)
                .map(ObjectRow::originalId)
                .collect(Collectors.toSet());
        return rows.stream()
                .filter(row -> row.userId() == null || userId.equals(row.userId()))
                .filter(row -> !shadowed.contains(row.objectId()))
                .toList();
    }
}
