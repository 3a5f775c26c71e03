package com.entity.semantic.pipeline;

/**
 * Failure taxonomy surfaced by the pipelines.
 */
public enum ErrorKind {
    /** The embedding model failed for this item. Retryable when the cause was transient. */
    EMBEDDING_FAILURE,
    /** The vector length differed from the index dimension. */
    DIMENSION_MISMATCH,
    /** The vector had zero norm. */
    DEGENERATE_VECTOR,
    /** The index has not finished initializing. Retry after a backoff. */
    INDEX_UNAVAILABLE,
    /** The query deadline passed before traversal started. */
    QUERY_TIMEOUT,
    /** Writing to or deleting from the durable store failed. */
    PERSISTENCE_FAILURE,
    /** Anything else. */
    INTERNAL
}
