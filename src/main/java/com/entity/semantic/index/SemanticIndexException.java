package com.entity.semantic.index;

/**
 * Base runtime exception for vector index failures.
 * Each failure is scoped to the single insert or query that raised it.
 */
public class SemanticIndexException extends RuntimeException {

    public SemanticIndexException(String message) {
        super(message);
    }

    public SemanticIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
