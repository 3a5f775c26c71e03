package com.entity.semantic.engine;

import com.entity.semantic.core.model.Provenance;

/**
 * A candidate the resolution engine accepted as a match.
 *
 * @param identifier the matched record identifier
 * @param score      the engine's own match score
 * @param provenance which candidate source proposed it
 * @param reason     engine-specific explanation, may be null
 */
public record ResolvedMatch(String identifier, double score, Provenance provenance, String reason) {
}
