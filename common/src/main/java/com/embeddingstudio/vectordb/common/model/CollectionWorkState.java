package com.embeddingstudio.vectordb.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * BLUE marks the collection currently serving traffic, every other collection is GREEN.
 */
public enum CollectionWorkState {
    GREEN, BLUE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
