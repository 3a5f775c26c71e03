package com.entity.semantic.index;

/**
 * Thrown for zero-norm (or non-finite) vectors, whose cosine similarity is undefined.
 */
public class DegenerateVectorException extends SemanticIndexException {

    public DegenerateVectorException(String message) {
        super(message);
    }
}
