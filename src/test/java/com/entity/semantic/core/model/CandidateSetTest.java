package com.entity.semantic.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CandidateSet Tests")
class CandidateSetTest {

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("ofExact should collapse duplicate identifiers")
        void ofExactCollapsesDuplicates() {
            CandidateSet set = CandidateSet.ofExact("CUSTOMERS:1", "CUSTOMERS:2", "CUSTOMERS:1");

            assertEquals(2, set.size());
            assertTrue(set.contains("CUSTOMERS:1"));
            assertEquals(Provenance.EXACT, set.get("CUSTOMERS:2").orElseThrow().provenance());
        }

        @Test
        @DisplayName("Empty builder should return the shared empty set")
        void emptyBuilder() {
            assertSame(CandidateSet.empty(), CandidateSet.builder().build());
            assertTrue(CandidateSet.ofExact(List.of()).isEmpty());
        }

        @Test
        @DisplayName("Candidates view should be unmodifiable")
        void unmodifiable() {
            CandidateSet set = CandidateSet.ofExact("A:1");
            assertThrows(UnsupportedOperationException.class,
                    () -> set.identifiers().add("A:2"));
        }
    }

    @Nested
    @DisplayName("Combining")
    class CombineTests {

        @Test
        @DisplayName("Exact plus semantic should become BOTH and keep the similarity")
        void exactPlusSemantic() {
            CandidateSet set = CandidateSet.builder()
                    .add(Candidate.exact("A:1"))
                    .add(Candidate.semantic("A:1", 0.82))
                    .build();

            Candidate candidate = set.get("A:1").orElseThrow();
            assertEquals(Provenance.BOTH, candidate.provenance());
            assertEquals(0.82, candidate.similarity().getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("Two semantic entries should keep the higher similarity")
        void keepsMaxSimilarity() {
            CandidateSet set = CandidateSet.builder()
                    .add(Candidate.semantic("A:1", 0.78))
                    .add(Candidate.semantic("A:1", 0.91))
                    .add(Candidate.semantic("A:1", 0.80))
                    .build();

            Candidate candidate = set.get("A:1").orElseThrow();
            assertEquals(Provenance.SEMANTIC, candidate.provenance());
            assertEquals(0.91, candidate.similarity().getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("toBuilder should leave the original set unchanged")
        void toBuilderCopies() {
            CandidateSet original = CandidateSet.ofExact("A:1");
            CandidateSet extended = original.toBuilder().add(Candidate.semantic("A:2", 0.9)).build();

            assertEquals(1, original.size());
            assertEquals(2, extended.size());
            assertEquals(Map.of(Provenance.EXACT, 1L, Provenance.SEMANTIC, 1L), extended.countByProvenance());
        }
    }

    @Nested
    @DisplayName("Equality")
    class EqualityTests {

        @Test
        @DisplayName("Equality should ignore insertion order")
        void orderInsensitive() {
            CandidateSet first = CandidateSet.ofExact("A:1", "A:2");
            CandidateSet second = CandidateSet.ofExact("A:2", "A:1");

            assertEquals(first, second);
            assertEquals(first.hashCode(), second.hashCode());
        }
    }

    @Nested
    @DisplayName("Candidate")
    class CandidateTests {

        @Test
        @DisplayName("Semantic candidate without a similarity should be rejected")
        void semanticRequiresSimilarity() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Candidate("A:1", Provenance.SEMANTIC, OptionalDouble.empty()));
        }

        @Test
        @DisplayName("Null similarity should normalize to empty")
        void nullSimilarity() {
            Candidate candidate = new Candidate("A:1", Provenance.EXACT, null);
            assertTrue(candidate.similarity().isEmpty());
            assertFalse(candidate.isSemantic());
        }

        @Test
        @DisplayName("Provenance should combine to BOTH across sources")
        void provenanceCombine() {
            assertEquals(Provenance.EXACT, Provenance.EXACT.combine(Provenance.EXACT));
            assertEquals(Provenance.BOTH, Provenance.EXACT.combine(Provenance.SEMANTIC));
            assertEquals(Provenance.BOTH, Provenance.BOTH.combine(Provenance.SEMANTIC));
        }
    }
}
