package com.entity.semantic.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of candidates keyed by identifier.
 * Iteration follows insertion order but equality ignores order: this is a set, not a ranking.
 */
public final class CandidateSet {

    private static final CandidateSet EMPTY = new CandidateSet(Map.of());

    private final Map<String, Candidate> candidates;

    private CandidateSet(Map<String, Candidate> candidates) {
        this.candidates = candidates;
    }

    public static CandidateSet empty() {
        return EMPTY;
    }

    /**
     * Builds a set of exact/phonetic candidates from identifiers. Duplicates collapse.
     */
    public static CandidateSet ofExact(Collection<String> identifiers) {
        Builder builder = builder();
        identifiers.forEach(id -> builder.add(Candidate.exact(id)));
        return builder.build();
    }

    public static CandidateSet ofExact(String... identifiers) {
        return ofExact(Arrays.asList(identifiers));
    }

    public Optional<Candidate> get(String identifier) {
        return Optional.ofNullable(candidates.get(identifier));
    }

    public boolean contains(String identifier) {
        return candidates.containsKey(identifier);
    }

    public Collection<Candidate> candidates() {
        return candidates.values();
    }

    public Set<String> identifiers() {
        return candidates.keySet();
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    /**
     * Counts candidates by provenance.
     */
    public Map<Provenance, Long> countByProvenance() {
        return candidates.values().stream()
                .collect(Collectors.groupingBy(Candidate::provenance, Collectors.counting()));
    }

    public Builder toBuilder() {
        Builder builder = builder();
        candidates.values().forEach(builder::add);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates candidates. Adding an identifier twice combines provenance and
     * keeps the higher similarity.
     */
    public static class Builder {
        private final Map<String, Candidate> candidates = new LinkedHashMap<>();

        public Builder add(Candidate candidate) {
            candidates.merge(candidate.identifier(), candidate, Builder::combine);
            return this;
        }

        public CandidateSet build() {
            if (candidates.isEmpty()) {
                return EMPTY;
            }
            return new CandidateSet(Collections.unmodifiableMap(new LinkedHashMap<>(candidates)));
        }

        private static Candidate combine(Candidate existing, Candidate incoming) {
            Provenance provenance = existing.provenance().combine(incoming.provenance());
            OptionalDouble similarity;
            if (existing.similarity().isPresent() && incoming.similarity().isPresent()) {
                similarity = OptionalDouble.of(Math.max(
                        existing.similarity().getAsDouble(), incoming.similarity().getAsDouble()));
            } else if (existing.similarity().isPresent()) {
                similarity = existing.similarity();
            } else {
                similarity = incoming.similarity();
            }
            return new Candidate(existing.identifier(), provenance, similarity);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CandidateSet that)) return false;
        return candidates.equals(that.candidates);
    }

    @Override
    public int hashCode() {
        return candidates.hashCode();
    }

    @Override
    public String toString() {
        return "CandidateSet{size=" + candidates.size() + ", byProvenance=" + countByProvenance() + '}';
    }
}
