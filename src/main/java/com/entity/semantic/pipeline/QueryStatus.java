package com.entity.semantic.pipeline;

/**
 * Terminal state of one search request.
 */
public enum QueryStatus {
    /** Semantic hits merged with the exact candidates. */
    MERGED,
    /** No canonical name: the exact candidates are returned as they are. */
    NO_NAME_SKIP,
    /** Embedding failed: the exact candidates are returned with the error. */
    EMBED_FAILED,
    /** The index query failed: the exact candidates are returned with the error. */
    QUERY_FAILED;

    public boolean isError() {
        return this == EMBED_FAILED || this == QUERY_FAILED;
    }
}
