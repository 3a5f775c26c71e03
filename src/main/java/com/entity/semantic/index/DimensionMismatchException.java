package com.entity.semantic.index;

/**
 * Thrown when an inserted or queried vector does not have the index dimension.
 */
public class DimensionMismatchException extends SemanticIndexException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Vector dimension " + actual + " does not match index dimension " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
