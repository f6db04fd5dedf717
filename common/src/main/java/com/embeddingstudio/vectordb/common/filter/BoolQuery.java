package com.embeddingstudio.vectordb.common.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;

import java.util.List;

/**
 * Boolean combination: all of {@code must} and {@code filter}, at least one of {@code should}
 * when it is not empty, and none of {@code mustNot}.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record BoolQuery(
    @Singular("must")
    @JsonProperty("must")
    List<PayloadFilter> must,

    @Singular("should")
    @JsonProperty("should")
    List<PayloadFilter> should,

    @Singular("filter")
    @JsonProperty("filter")
    List<PayloadFilter> filter,

    @Singular("mustNot")
    @JsonProperty("must_not")
    List<PayloadFilter> mustNot
) implements PayloadFilter {
    @JsonCreator
    public BoolQuery {
        must = must == null ? List.of() : List.copyOf(must);
        should = should == null ? List.of() : List.copyOf(should);
        filter = filter == null ? List.of() : List.copyOf(filter);
        mustNot = mustNot == null ? List.of() : List.copyOf(mustNot);
    }
}
