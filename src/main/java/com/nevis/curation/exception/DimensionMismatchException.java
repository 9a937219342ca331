package com.nevis.curation.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends RuntimeException {
    private final String itemId;
    private final int expected;
    private final int actual;

    public DimensionMismatchException(String itemId, int expected, int actual) {
        super("Vector for " + itemId + " has " + actual + " dimensions, expected " + expected);
        this.itemId = itemId;
        this.expected = expected;
        this.actual = actual;
    }
}
