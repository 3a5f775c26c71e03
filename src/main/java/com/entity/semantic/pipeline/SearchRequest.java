package com.entity.semantic.pipeline;

import com.entity.semantic.core.model.CandidateSet;
import com.entity.semantic.core.model.SourceRecord;

import java.util.Objects;

/**
 * A search record plus the exact/phonetic candidates found for it elsewhere.
 * Threshold and limit override the pipeline defaults when set.
 *
 * @param requestId       correlation id for logs and outcomes
 * @param record          the search record
 * @param exactCandidates candidates from the exact/phonetic source
 * @param threshold       similarity threshold override, or null
 * @param limit           result limit override, or null
 */
public record SearchRequest(String requestId, SourceRecord record, CandidateSet exactCandidates,
                            Double threshold, Integer limit) {

    public SearchRequest {
        Objects.requireNonNull(record, "record is required");
        requestId = requestId != null ? requestId : record.identifier();
        exactCandidates = exactCandidates != null ? exactCandidates : CandidateSet.empty();
        if (threshold != null) {
            PipelineOptions.validateThreshold(threshold);
        }
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
    }

    public static SearchRequest of(SourceRecord record) {
        return new SearchRequest(null, record, CandidateSet.empty(), null, null);
    }

    public static SearchRequest of(SourceRecord record, CandidateSet exactCandidates) {
        return new SearchRequest(null, record, exactCandidates, null, null);
    }

    public SearchRequest withThreshold(double threshold) {
        return new SearchRequest(requestId, record, exactCandidates, threshold, limit);
    }

    public SearchRequest withLimit(int limit) {
        return new SearchRequest(requestId, record, exactCandidates, threshold, limit);
    }

    public SearchRequest withRequestId(String requestId) {
        return new SearchRequest(requestId, record, exactCandidates, threshold, limit);
    }
}
