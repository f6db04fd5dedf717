package com.embeddingstudio.vectordb.common.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends VectorDbException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(String.format("Vector dimension mismatch. Expected: %d, got: %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }
}
