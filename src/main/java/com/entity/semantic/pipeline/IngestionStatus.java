package com.entity.semantic.pipeline;

/**
 * Terminal state of one record's ingestion.
 */
public enum IngestionStatus {
    /** Name extracted, embedded and stored in the index. */
    INDEXED,
    /** No canonical name: the record is left to exact matching only. Not an error. */
    NO_NAME_SKIP,
    /** The embedding step failed for this record. */
    EMBED_FAILED,
    /** The index rejected the vector. */
    INDEX_FAILED,
    /** Indexed, but the durable store write failed. */
    PERSIST_FAILED;

    public boolean isError() {
        return this == EMBED_FAILED || this == INDEX_FAILED || this == PERSIST_FAILED;
    }
}
