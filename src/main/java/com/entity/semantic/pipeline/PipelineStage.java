package com.entity.semantic.pipeline;

/**
 * Stages a record or search request moves through.
 * {@code RECEIVED -> NAME_EXTRACTED -> EMBEDDED -> INDEXED | QUERIED -> MERGED -> DONE}.
 */
public enum PipelineStage {
    RECEIVED,
    NAME_EXTRACTED,
    EMBEDDED,
    INDEXED,
    PERSISTED,
    QUERIED,
    MERGED,
    DONE
}
