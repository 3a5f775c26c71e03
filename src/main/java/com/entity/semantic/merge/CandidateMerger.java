package com.entity.semantic.merge;

import com.entity.semantic.core.model.Candidate;
import com.entity.semantic.core.model.CandidateSet;
import com.entity.semantic.core.model.SemanticHit;

import java.util.List;

/**
 * Unions an exact/phonetic candidate set with semantic index hits.
 *
 * <p>Identifiers found by both sources become {@code BOTH} and keep their similarity.
 * The exact set is returned as-is when there are no semantic hits.</p>
 */
public class CandidateMerger {

    public CandidateSet merge(CandidateSet exactCandidates, List<SemanticHit> semanticResults) {
        CandidateSet exact = exactCandidates != null ? exactCandidates : CandidateSet.empty();
        if (semanticResults == null || semanticResults.isEmpty()) {
            return exact;
        }
        CandidateSet.Builder builder = exact.toBuilder();
        for (SemanticHit hit : semanticResults) {
            builder.add(Candidate.semantic(hit.identifier(), hit.similarity()));
        }
        return builder.build();
    }
}
