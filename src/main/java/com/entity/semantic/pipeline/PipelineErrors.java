package com.entity.semantic.pipeline;

import com.entity.semantic.embedding.EmbeddingResult;
import com.entity.semantic.index.DegenerateVectorException;
import com.entity.semantic.index.DimensionMismatchException;
import com.entity.semantic.index.IndexUnavailableException;
import com.entity.semantic.index.QueryTimeoutException;

/**
 * Translates component failures into {@link PipelineError} values. The stage is the step
 * that failed.
 */
final class PipelineErrors {

    private PipelineErrors() {
    }

    static PipelineError embedding(String identifier, EmbeddingResult result) {
        return new PipelineError(identifier, PipelineStage.EMBEDDED, ErrorKind.EMBEDDING_FAILURE,
                result.error(), result.retryable());
    }

    static PipelineError fromException(String identifier, PipelineStage stage, RuntimeException e) {
        ErrorKind kind;
        boolean retryable;
        if (e instanceof DimensionMismatchException) {
            kind = ErrorKind.DIMENSION_MISMATCH;
            retryable = false;
        } else if (e instanceof DegenerateVectorException) {
            kind = ErrorKind.DEGENERATE_VECTOR;
            retryable = false;
        } else if (e instanceof IndexUnavailableException) {
            kind = ErrorKind.INDEX_UNAVAILABLE;
            retryable = true;
        } else if (e instanceof QueryTimeoutException) {
            kind = ErrorKind.QUERY_TIMEOUT;
            retryable = true;
        } else {
            kind = ErrorKind.INTERNAL;
            retryable = false;
        }
        return new PipelineError(identifier, stage, kind, e.getMessage(), retryable);
    }

    static PipelineError persistence(String identifier, RuntimeException e) {
        return new PipelineError(identifier, PipelineStage.PERSISTED, ErrorKind.PERSISTENCE_FAILURE,
                e.getMessage(), true);
    }
}
