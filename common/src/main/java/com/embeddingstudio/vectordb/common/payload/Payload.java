package com.embeddingstudio.vectordb.common.payload;

import com.embeddingstudio.vectordb.common.serialization.PayloadDeserializer;
import com.embeddingstudio.vectordb.common.serialization.PayloadSerializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered key to value map attached to a stored object. Immutable.
 */
@EqualsAndHashCode
@JsonSerialize(using = PayloadSerializer.class)
@JsonDeserialize(using = PayloadDeserializer.class)
public final class Payload {

    private static final Payload EMPTY = new Payload(Map.of());

    private final Map<String, PayloadValue> entries;

    private Payload(Map<String, PayloadValue> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Payload empty() {
        return EMPTY;
    }

    public static Payload of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, PayloadValue> entries = new LinkedHashMap<>();
        values.forEach((key, value) -> entries.put(key, PayloadValue.of(value)));
        return new Payload(entries);
    }

    public static Payload ofValues(Map<String, PayloadValue> values) {
        return values == null || values.isEmpty() ? EMPTY : new Payload(values);
    }

    public Map<String, PayloadValue> entries() {
        return entries;
    }

    public Optional<PayloadValue> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Looks up a top-level key. A key stored with an explicit null counts as absent.
     */
    public Optional<PayloadValue> value(String key) {
        return get(key).filter(value -> !value.isNull());
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public Payload with(String key, Object value) {
        Map<String, PayloadValue> copy = new LinkedHashMap<>(entries);
        copy.put(key, PayloadValue.of(value));
        return new Payload(copy);
    }

    @Override
    public String toString() {
        return "Payload" + entries;
    }
}
