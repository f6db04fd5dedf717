package com.embeddingstudio.vectordb.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collection;

/**
 * How the distances of an object's parts fold into one object distance.
 */
public enum MetricAggregationType {
    MIN("min") {
        @Override
        public double aggregate(Collection<Double> distances) {
            requireNotEmpty(distances);
            return distances.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        }
    },
    AVG("avg") {
        @Override
        public double aggregate(Collection<Double> distances) {
            requireNotEmpty(distances);
            return distances.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        }
    };

    private final String value;

    MetricAggregationType(String value) {
        this.value = value;
    }

    public abstract double aggregate(Collection<Double> distances);

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static MetricAggregationType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown metric aggregation type: " + value));
    }

    private static void requireNotEmpty(Collection<Double> distances) {
        if (distances == null || distances.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty set of distances");
        }
    }
}
