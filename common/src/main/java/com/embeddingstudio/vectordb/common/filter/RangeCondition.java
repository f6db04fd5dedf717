package com.embeddingstudio.vectordb.common.filter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RangeCondition(
    @JsonProperty("gte")
    BigDecimal gte,

    @JsonProperty("lte")
    BigDecimal lte,

    @JsonProperty("gt")
    BigDecimal gt,

    @JsonProperty("lt")
    BigDecimal lt,

    @JsonProperty("eq")
    BigDecimal eq
) {
    public boolean isEmpty() {
        return gte == null && lte == null && gt == null && lt == null && eq == null;
    }
}
