package com.embeddingstudio.vectordb.common.query;

public enum FilterOperator {
    TEXT_MATCH,
    PHRASE_MATCH,
    GLOB,
    EQ,
    IN,
    EXISTS,
    GTE,
    LTE,
    GT,
    LT
}
