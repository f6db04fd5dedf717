package com.embeddingstudio.vectordb.common.filter;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Elasticsearch-style filter over object payloads. Serialized as a single-key object
 * naming the query kind, for example {@code {"term": {"field": "color", "value": "red"}}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = MatchQuery.class, name = "match"),
    @JsonSubTypes.Type(value = TermQuery.class, name = "term"),
    @JsonSubTypes.Type(value = TermsQuery.class, name = "terms"),
    @JsonSubTypes.Type(value = MatchPhraseQuery.class, name = "match_phrase"),
    @JsonSubTypes.Type(value = ExistsQuery.class, name = "exists"),
    @JsonSubTypes.Type(value = WildcardQuery.class, name = "wildcard"),
    @JsonSubTypes.Type(value = RangeQuery.class, name = "range"),
    @JsonSubTypes.Type(value = BoolQuery.class, name = "bool")
})
public sealed interface PayloadFilter
        permits MatchQuery, TermQuery, TermsQuery, MatchPhraseQuery, ExistsQuery, WildcardQuery, RangeQuery,
        BoolQuery {
}
