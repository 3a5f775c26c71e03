package com.entity.semantic.engine;

import com.entity.semantic.core.model.CandidateSet;
import com.entity.semantic.core.model.SourceRecord;

/**
 * The external exact/phonetic candidate generator.
 */
@FunctionalInterface
public interface ExactCandidateSource {

    CandidateSet candidatesFor(SourceRecord record);

    /**
     * A source that never proposes anything, for semantic-only use.
     */
    ExactCandidateSource NONE = record -> CandidateSet.empty();
}
