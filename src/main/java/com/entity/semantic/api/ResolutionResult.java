package com.entity.semantic.api;

import com.entity.semantic.engine.ResolvedMatch;
import com.entity.semantic.pipeline.QueryOutcome;

import java.util.List;

/**
 * Candidates generated for a record and the matches the resolution engine kept.
 *
 * @param outcome the candidate-generation outcome
 * @param matches the engine's matches, empty if none
 */
public record ResolutionResult(QueryOutcome outcome, List<ResolvedMatch> matches) {

    public ResolutionResult {
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    public boolean hasMatches() {
        return !matches.isEmpty();
    }
}
