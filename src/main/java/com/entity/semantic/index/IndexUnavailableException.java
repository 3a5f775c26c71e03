package com.entity.semantic.index;

/**
 * Thrown when the index is still initializing (for example while it is rebuilt from the
 * durable store). Callers should retry after a backoff.
 */
public class IndexUnavailableException extends SemanticIndexException {

    public IndexUnavailableException(String message) {
        super(message);
    }
}
