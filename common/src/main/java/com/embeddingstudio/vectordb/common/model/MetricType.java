package com.embeddingstudio.vectordb.common.model;

import com.embeddingstudio.vectordb.common.similarity.VectorSimilarity;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Distance used to compare a query vector with stored parts. Smaller is closer for every metric.
 */
public enum MetricType {
    COSINE("cosine") {
        @Override
        public double distance(float[] a, float[] b) {
            return 1.0 - VectorSimilarity.cosineSimilarity(a, b);
        }
    },
    DOT("dot") {
        @Override
        public double distance(float[] a, float[] b) {
            return -VectorSimilarity.dot(a, b);
        }
    },
    EUCLID("euclid") {
        @Override
        public double distance(float[] a, float[] b) {
            return VectorSimilarity.euclideanDistance(a, b);
        }
    };

    private final String value;

    MetricType(String value) {
        this.value = value;
    }

    public abstract double distance(float[] a, float[] b);

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static MetricType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown metric type: " + value));
    }
}
