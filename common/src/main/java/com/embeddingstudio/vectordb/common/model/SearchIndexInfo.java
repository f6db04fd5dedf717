package com.embeddingstudio.vectordb.common.model;

import com.embeddingstudio.vectordb.common.exception.DimensionMismatchException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import lombok.Builder;

/**
 * Search index shape of a collection: vector dimensions and how distances are computed.
 */
@Builder
public record SearchIndexInfo(
    @Min(1)
    @JsonProperty("dimensions")
    int dimensions,

    @JsonProperty("metric_type")
    MetricType metricType,

    @JsonProperty("metric_aggregation_type")
    MetricAggregationType metricAggregationType,

    @JsonProperty("hnsw")
    HnswParameters hnsw
) {
    @JsonCreator
    public SearchIndexInfo {
        if (dimensions < 1) {
            throw new IllegalArgumentException("Dimensions must be positive, got: " + dimensions);
        }
        metricType = metricType == null ? MetricType.COSINE : metricType;
        metricAggregationType = metricAggregationType == null ? MetricAggregationType.MIN : metricAggregationType;
        hnsw = hnsw == null ? HnswParameters.defaults() : hnsw;
    }

    public static SearchIndexInfo of(int dimensions) {
        return new SearchIndexInfo(dimensions, null, null, null);
    }

    /**
     * @throws DimensionMismatchException when the vector length differs from {@link #dimensions()}
     */
    public void validateDimensions(float[] vector) {
        if (vector == null) {
            throw new IllegalArgumentException("Vector cannot be null");
        }
        if (vector.length != dimensions) {
            throw new DimensionMismatchException(dimensions, vector.length);
        }
    }

    public double distance(float[] a, float[] b) {
        return metricType.distance(a, b);
    }
}
