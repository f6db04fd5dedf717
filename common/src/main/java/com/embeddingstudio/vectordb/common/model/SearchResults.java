package com.embeddingstudio.vectordb.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of search hits.
 *
 * @param nextOffset  offset of the next page, set only when this page is full
 * @param subsetCount number of objects that matched before pagination
 */
public record SearchResults(
    @JsonProperty("found_objects")
    List<FoundObject> foundObjects,

    @JsonProperty("next_offset")
    Integer nextOffset,

    @JsonProperty("subset_count")
    int subsetCount
) {
    public SearchResults {
        foundObjects = foundObjects == null ? List.of() : List.copyOf(foundObjects);
    }

    public static SearchResults empty() {
        return new SearchResults(List.of(), null, 0);
    }

    public List<String> objectIds() {
        return foundObjects.stream().map(FoundObject::objectId).toList();
    }
}
