package com.entity.semantic.core.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A record identifier proposed as a possible match, before scoring.
 *
 * @param identifier the record identifier
 * @param provenance which source found it
 * @param similarity the cosine similarity when the semantic source found it, empty otherwise
 */
public record Candidate(String identifier, Provenance provenance, OptionalDouble similarity) {

    public Candidate {
        Objects.requireNonNull(identifier, "identifier is required");
        Objects.requireNonNull(provenance, "provenance is required");
        similarity = similarity != null ? similarity : OptionalDouble.empty();
        if (provenance == Provenance.SEMANTIC && similarity.isEmpty()) {
            throw new IllegalArgumentException("Semantic candidate requires a similarity score");
        }
    }

    public static Candidate exact(String identifier) {
        return new Candidate(identifier, Provenance.EXACT, OptionalDouble.empty());
    }

    public static Candidate semantic(String identifier, double similarity) {
        return new Candidate(identifier, Provenance.SEMANTIC, OptionalDouble.of(similarity));
    }

    public boolean isSemantic() {
        return provenance != Provenance.EXACT;
    }
}
