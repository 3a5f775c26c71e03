package com.entity.semantic.pipeline;

import java.util.Optional;

/**
 * Result of ingesting one record.
 *
 * @param identifier    the record identifier
 * @param status        the terminal state
 * @param canonicalName the extracted name, null for {@link IngestionStatus#NO_NAME_SKIP}
 * @param error         the failure, null unless {@code status.isError()}
 */
public record IngestionOutcome(String identifier, IngestionStatus status, String canonicalName,
                               PipelineError error) {

    public static IngestionOutcome indexed(String identifier, String canonicalName) {
        return new IngestionOutcome(identifier, IngestionStatus.INDEXED, canonicalName, null);
    }

    public static IngestionOutcome skipped(String identifier) {
        return new IngestionOutcome(identifier, IngestionStatus.NO_NAME_SKIP, null, null);
    }

    public static IngestionOutcome failed(IngestionStatus status, String canonicalName, PipelineError error) {
        return new IngestionOutcome(error.identifier(), status, canonicalName, error);
    }

    public boolean isIndexed() {
        return status == IngestionStatus.INDEXED;
    }

    public Optional<PipelineError> getError() {
        return Optional.ofNullable(error);
    }
}
