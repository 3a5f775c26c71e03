package com.entity.semantic.index;

/**
 * Thrown when a query deadline has already passed before any traversal started.
 * A deadline reached during traversal is not an exception: the partial result is
 * returned with {@link QueryResult#truncated()} set.
 */
public class QueryTimeoutException extends SemanticIndexException {

    public QueryTimeoutException(String message) {
        super(message);
    }
}
