package com.entity.semantic.pipeline;

import com.entity.semantic.core.model.CandidateSet;

import java.util.Optional;

/**
 * Result of one search request. On failure the candidates are the exact set alone.
 *
 * @param requestId     the request's correlation id
 * @param status        the terminal state
 * @param canonicalName the extracted name, null for {@link QueryStatus#NO_NAME_SKIP}
 * @param candidates    the merged candidate set
 * @param semanticHits  number of index hits merged in
 * @param truncated     true when the query deadline cut the index traversal short
 * @param error         the failure, null unless {@code status.isError()}
 */
public record QueryOutcome(String requestId, QueryStatus status, String canonicalName,
                           CandidateSet candidates, int semanticHits, boolean truncated,
                           PipelineError error) {

    public static QueryOutcome merged(String requestId, String canonicalName, CandidateSet candidates,
                                      int semanticHits, boolean truncated) {
        return new QueryOutcome(requestId, QueryStatus.MERGED, canonicalName, candidates,
                semanticHits, truncated, null);
    }

    public static QueryOutcome skipped(String requestId, CandidateSet exactCandidates) {
        return new QueryOutcome(requestId, QueryStatus.NO_NAME_SKIP, null, exactCandidates, 0, false, null);
    }

    public static QueryOutcome failed(QueryStatus status, String canonicalName, CandidateSet exactCandidates,
                                      PipelineError error) {
        return new QueryOutcome(error.identifier(), status, canonicalName, exactCandidates, 0, false, error);
    }

    public Optional<PipelineError> getError() {
        return Optional.ofNullable(error);
    }
}
