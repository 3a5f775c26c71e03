package com.entity.semantic.engine;

import com.entity.semantic.core.model.CandidateSet;
import com.entity.semantic.core.model.SourceRecord;

import java.util.List;

/**
 * The external resolution engine that scores merged candidates with its own
 * non-semantic features. This library never depends on how scoring is done.
 */
@FunctionalInterface
public interface CandidateScorer {

    List<ResolvedMatch> score(SourceRecord record, CandidateSet candidates);
}
