package com.entity.semantic.pipeline;

import java.util.Objects;

/**
 * A pipeline failure as a value: which item, at which stage, what kind, and whether a
 * retry may succeed.
 */
public record PipelineError(String identifier, PipelineStage stage, ErrorKind kind,
                            String message, boolean retryable) {

    public PipelineError {
        Objects.requireNonNull(stage, "stage is required");
        Objects.requireNonNull(kind, "kind is required");
        message = message != null ? message : kind.name();
    }

    @Override
    public String toString() {
        return "PipelineError{" + identifier + " at " + stage + ": " + kind + " - " + message
                + (retryable ? " (retryable)" : "") + '}';
    }
}
