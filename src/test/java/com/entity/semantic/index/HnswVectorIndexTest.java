package com.entity.semantic.index;

import com.entity.semantic.core.model.Embedding;
import com.entity.semantic.core.model.SemanticHit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HnswVectorIndex Tests")
class HnswVectorIndexTest {

    private static final int DIMENSION = 16;

    private HnswVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new HnswVectorIndex(HnswConfig.withDimension(DIMENSION));
    }

    static Embedding randomVector(Random random, int dimension) {
        float[] values = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            values[i] = (float) random.nextGaussian();
        }
        return Embedding.of(values);
    }

    static Embedding axis(int axis) {
        float[] values = new float[DIMENSION];
        values[axis] = 1f;
        return Embedding.of(values);
    }

    @Nested
    @DisplayName("Insert and query")
    class InsertQueryTests {

        @Test
        @DisplayName("Query with an inserted vector should return it first with similarity near 1")
        void selfSimilarity() {
            Random random = new Random(7);
            List<Embedding> vectors = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                Embedding v = randomVector(random, DIMENSION);
                vectors.add(v);
                index.insert("R:" + i, "name " + i, v);
            }

            for (int i = 0; i < 200; i += 17) {
                QueryResult result = index.query(vectors.get(i), 0.0, 5);
                SemanticHit top = result.hits().get(0);
                assertEquals("R:" + i, top.identifier());
                assertEquals("name " + i, top.canonicalName());
                assertTrue(top.similarity() >= 0.99);
            }
        }

        @Test
        @DisplayName("Query on an empty index should return no hits")
        void emptyIndex() {
            QueryResult result = index.query(axis(0), 0.5, 10);
            assertTrue(result.isEmpty());
            assertFalse(result.truncated());
            assertEquals(-1, index.topLayer());
        }

        @Test
        @DisplayName("Hits should be ordered by descending similarity and respect the limit")
        void orderAndLimit() {
            Random random = new Random(11);
            for (int i = 0; i < 300; i++) {
                index.insert("R:" + i, "n" + i, randomVector(random, DIMENSION));
            }

            QueryResult result = index.query(randomVector(random, DIMENSION), -1.0, 7);

            assertEquals(7, result.size());
            for (int i = 1; i < result.size(); i++) {
                assertTrue(result.hits().get(i - 1).similarity() >= result.hits().get(i).similarity());
            }
            assertTrue(result.visited() > 0);
        }

        @Test
        @DisplayName("Threshold should be inclusive")
        void inclusiveThreshold() {
            index.insert("A:1", "x", axis(0));
            index.insert("A:2", "y", axis(1));

            QueryResult exact = index.query(axis(0), 1.0, 10);
            assertEquals(1, exact.size());
            assertEquals("A:1", exact.hits().get(0).identifier());

            QueryResult orthogonal = index.query(axis(0), 0.0, 10);
            assertEquals(Set.of("A:1", "A:2"),
                    orthogonal.hits().stream().map(SemanticHit::identifier).collect(Collectors.toSet()));
        }

        @Test
        @DisplayName("Entries below the threshold should not be returned")
        void belowThreshold() {
            index.insert("A:1", "x", axis(0));
            index.insert("A:2", "y", axis(1));

            QueryResult result = index.query(axis(0), 0.5, 10);

            assertEquals(List.of("A:1"), result.hits().stream().map(SemanticHit::identifier).toList());
        }
    }

    @Nested
    @DisplayName("Replace and delete")
    class ReplaceDeleteTests {

        @Test
        @DisplayName("Re-inserting the same entry should be a no-op")
        void idempotentInsert() {
            index.insert("A:1", "Alice", axis(0));
            index.insert("A:1", "Alice", axis(0));

            assertEquals(1, index.size());
            assertEquals(1, index.nodeCount());
            assertEquals(0, index.tombstoneCount());
        }

        @Test
        @DisplayName("Replacing an entry should hide the old vector")
        void replaceHidesOld() {
            index.insert("A:1", "Alice", axis(0));
            index.insert("A:1", "Alicia", axis(1));

            assertEquals(1, index.size());
            assertEquals(1, index.tombstoneCount());
            assertTrue(index.query(axis(0), 0.9, 10).isEmpty());

            QueryResult result = index.query(axis(1), 0.9, 10);
            assertEquals(1, result.size());
            assertEquals("Alicia", result.hits().get(0).canonicalName());
            assertEquals("Alicia", index.get("A:1").orElseThrow().canonicalName());
        }

        @Test
        @DisplayName("Deleted entries should never be returned")
        void deleteHides() {
            index.insert("A:1", "Alice", axis(0));
            index.insert("A:2", "Bob", axis(1));

            assertTrue(index.delete("A:1"));
            assertFalse(index.delete("A:1"));

            assertTrue(index.query(axis(0), 0.5, 10).isEmpty());
            assertTrue(index.get("A:1").isEmpty());
            assertEquals(1, index.size());
            assertEquals(2, index.nodeCount());
        }

        @Test
        @DisplayName("Queries should still route through tombstones")
        void routesThroughTombstones() {
            Random random = new Random(3);
            List<Embedding> vectors = new ArrayList<>();
            for (int i = 0; i < 500; i++) {
                Embedding v = randomVector(random, DIMENSION);
                vectors.add(v);
                index.insert("R:" + i, "n" + i, v);
            }
            for (int i = 0; i < 500; i += 2) {
                index.delete("R:" + i);
            }

            for (int i = 1; i < 500; i += 50) {
                QueryResult result = index.query(vectors.get(i), 0.0, 3);
                assertEquals("R:" + i, result.hits().get(0).identifier());
                assertTrue(result.hits().stream().allMatch(h -> Integer.parseInt(h.identifier().substring(2)) % 2 == 1));
            }
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Wrong dimension should be rejected on insert and query")
        void dimensionMismatch() {
            DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
                    () -> index.insert("A:1", "x", Embedding.of(1.0, 2.0)));
            assertEquals(DIMENSION, e.getExpected());
            assertEquals(2, e.getActual());

            assertThrows(DimensionMismatchException.class,
                    () -> index.query(Embedding.of(1.0, 2.0), 0.5, 10));
            assertEquals(0, index.size());
        }

        @Test
        @DisplayName("Zero vector should be rejected")
        void degenerateVector() {
            assertThrows(DegenerateVectorException.class,
                    () -> index.insert("A:1", "x", Embedding.of(new float[DIMENSION])));
            assertThrows(DegenerateVectorException.class,
                    () -> index.query(Embedding.of(new float[DIMENSION]), 0.5, 10));
        }

        @Test
        @DisplayName("Initializing index should accept inserts but reject queries until ready")
        void initializing() {
            HnswVectorIndex starting = HnswVectorIndex.initializing(HnswConfig.withDimension(DIMENSION));
            starting.insert("A:1", "x", axis(0));

            assertFalse(starting.isReady());
            assertThrows(IndexUnavailableException.class, () -> starting.query(axis(0), 0.5, 10));

            starting.markReady();
            assertEquals(1, starting.query(axis(0), 0.5, 10).size());
        }

        @Test
        @DisplayName("Deadline already past should raise QueryTimeoutException")
        void pastDeadline() {
            index.insert("A:1", "x", axis(0));
            assertThrows(QueryTimeoutException.class,
                    () -> index.query(axis(0), 0.5, 10, Instant.now().minusSeconds(1)));
        }

        @Test
        @DisplayName("Invalid limit and blank identifier should be rejected")
        void invalidArguments() {
            assertThrows(IllegalArgumentException.class, () -> index.query(axis(0), 0.5, 0));
            assertThrows(IllegalArgumentException.class, () -> index.query(axis(0), Double.NaN, 5));
            assertThrows(IllegalArgumentException.class, () -> index.insert(" ", "x", axis(0)));
        }

        @Test
        @DisplayName("Config should reject inconsistent values")
        void invalidConfig() {
            assertThrows(IllegalArgumentException.class, () -> HnswConfig.builder().m(1));
            assertThrows(IllegalArgumentException.class,
                    () -> HnswConfig.builder().m(32).efConstruction(16).build());
            assertEquals(32, HnswConfig.builder().m(16).build().maxConnections(0));
            assertThrows(IllegalArgumentException.class, () -> HnswConfig.builder().compactionThreshold(0.0));
            assertThrows(IllegalArgumentException.class, () -> HnswConfig.builder().compactionMinNodes(-1));
        }
    }

    @Nested
    @DisplayName("Recall")
    class RecallTests {

        @Test
        @DisplayName("Recall@10 against exact search should be at least 0.9")
        void recallAgainstBruteForce() {
            Random random = new Random(42);
            BruteForceVectorIndex exact = new BruteForceVectorIndex(DIMENSION);
            for (int i = 0; i < 1000; i++) {
                Embedding v = randomVector(random, DIMENSION);
                index.insert("R:" + i, "n" + i, v);
                exact.insert("R:" + i, "n" + i, v);
            }

            int found = 0;
            int expected = 0;
            for (int q = 0; q < 50; q++) {
                Embedding query = randomVector(random, DIMENSION);
                Set<String> truth = exact.query(query, -1.0, 10).hits().stream()
                        .map(SemanticHit::identifier).collect(Collectors.toSet());
                Set<String> approx = index.query(query, -1.0, 10).hits().stream()
                        .map(SemanticHit::identifier).collect(Collectors.toSet());
                expected += truth.size();
                approx.retainAll(truth);
                found += approx.size();
            }

            double recall = (double) found / expected;
            assertTrue(recall >= 0.9, "recall was " + recall);
        }
    }

    @Nested
    @DisplayName("Compaction")
    class CompactionTests {

        @Test
        @DisplayName("Repeated replacement should keep the graph bounded and recall high")
        void repeatedReplacement() {
            HnswVectorIndex compacting = new HnswVectorIndex(HnswConfig.builder()
                    .dimension(DIMENSION)
                    .compactionMinNodes(100)
                    .build());
            BruteForceVectorIndex exact = new BruteForceVectorIndex(DIMENSION);
            Random random = new Random(11);
            for (int round = 0; round < 10; round++) {
                for (int i = 0; i < 300; i++) {
                    Embedding v = randomVector(random, DIMENSION);
                    compacting.insert("R:" + i, "n" + i + "-" + round, v);
                    exact.insert("R:" + i, "n" + i + "-" + round, v);
                }
            }

            assertEquals(300, compacting.size());
            assertTrue(compacting.compactionCount() > 0);
            assertTrue(compacting.nodeCount() < 2 * compacting.size(),
                    "nodeCount was " + compacting.nodeCount());

            int found = 0;
            int expected = 0;
            for (int q = 0; q < 50; q++) {
                Embedding query = randomVector(random, DIMENSION);
                Set<String> truth = exact.query(query, -1.0, 10).hits().stream()
                        .map(SemanticHit::identifier).collect(Collectors.toSet());
                Set<String> approx = compacting.query(query, -1.0, 10).hits().stream()
                        .map(SemanticHit::identifier).collect(Collectors.toSet());
                expected += truth.size();
                approx.retainAll(truth);
                found += approx.size();
            }
            double recall = (double) found / expected;
            assertTrue(recall >= 0.9, "recall was " + recall);
            assertEquals("n7-9", compacting.get("R:7").orElseThrow().canonicalName());
        }

        @Test
        @DisplayName("Graphs below the minimum size should keep their tombstones")
        void smallGraphNotCompacted() {
            for (int i = 0; i < 10; i++) {
                index.insert("A:1", "v" + i, axis(i % DIMENSION));
            }

            assertEquals(0, index.compactionCount());
            assertEquals(9, index.tombstoneCount());
            assertEquals(10, index.nodeCount());
        }

        @Test
        @DisplayName("Explicit compaction should drop tombstones and keep live entries")
        void explicitCompaction() {
            index.insert("A:1", "old", axis(0));
            index.insert("A:1", "new", axis(1));
            index.insert("A:2", "gone", axis(2));
            index.insert("A:3", "kept", axis(3));
            index.delete("A:2");

            index.compact();

            assertEquals(2, index.size());
            assertEquals(2, index.nodeCount());
            assertEquals(0, index.tombstoneCount());
            assertEquals("new", index.get("A:1").orElseThrow().canonicalName());
            assertEquals("A:3", index.query(axis(3), 0.9, 5).hits().get(0).identifier());
        }

        @Test
        @DisplayName("Compaction under concurrent writers and readers should lose no entry")
        void concurrentCompaction() throws Exception {
            HnswVectorIndex compacting = new HnswVectorIndex(HnswConfig.builder()
                    .dimension(DIMENSION)
                    .compactionMinNodes(50)
                    .build());
            ExecutorService pool = Executors.newFixedThreadPool(5);
            CountDownLatch start = new CountDownLatch(1);
            ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();
            for (int w = 0; w < 4; w++) {
                int worker = w;
                pool.submit(() -> {
                    try {
                        start.await();
                        Random random = new Random(worker);
                        for (int round = 0; round < 20; round++) {
                            for (int i = 0; i < 100; i++) {
                                compacting.insert("R:" + i, "w" + worker, randomVector(random, DIMENSION));
                            }
                        }
                    } catch (Throwable t) {
                        errors.add(t);
                    }
                });
            }
            pool.submit(() -> {
                try {
                    start.await();
                    Random random = new Random(99);
                    for (int q = 0; q < 500; q++) {
                        assertTrue(compacting.query(randomVector(random, DIMENSION), -1.0, 5).size() <= 5);
                    }
                } catch (Throwable t) {
                    errors.add(t);
                }
            });
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(2, TimeUnit.MINUTES));

            assertTrue(errors.isEmpty(), () -> "errors: " + errors);
            assertEquals(100, compacting.size());
            assertTrue(compacting.compactionCount() > 0);
            assertTrue(compacting.nodeCount() < 2 * compacting.size(),
                    "nodeCount was " + compacting.nodeCount());
            for (int i = 0; i < 100; i++) {
                assertTrue(compacting.get("R:" + i).isPresent());
            }
        }

        @Test
        @DisplayName("Tombstones nearest the query should not crowd out live hits")
        void tombstonesDoNotTakeResultSlots() {
            HnswVectorIndex narrow = new HnswVectorIndex(HnswConfig.builder()
                    .dimension(DIMENSION)
                    .efSearch(10)
                    .build());
            Random random = new Random(3);
            for (int i = 0; i < 50; i++) {
                float[] values = new float[DIMENSION];
                values[0] = 1f;
                for (int d = 1; d < DIMENSION; d++) {
                    values[d] = (float) (random.nextGaussian() * 0.05);
                }
                narrow.insert("DEAD:" + i, "dead " + i, Embedding.of(values));
            }
            for (int i = 0; i < 50; i++) {
                narrow.insert("LIVE:" + i, "live " + i, randomVector(random, DIMENSION));
            }
            for (int i = 0; i < 50; i++) {
                narrow.delete("DEAD:" + i);
            }

            List<SemanticHit> hits = narrow.query(axis(0), -1.0, 5).hits();

            assertEquals(5, hits.size());
            assertTrue(hits.stream().allMatch(h -> h.identifier().startsWith("LIVE:")));
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Concurrent inserts from 8 workers should keep one entry per identifier")
        void concurrentInserts() throws Exception {
            HnswVectorIndex concurrent = new HnswVectorIndex(HnswConfig.builder()
                    .dimension(DIMENSION).m(12).efConstruction(48).efSearch(64).build());
            int workers = 8;
            int perWorker = 1250;
            ExecutorService pool = Executors.newFixedThreadPool(workers);
            CountDownLatch start = new CountDownLatch(1);
            ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();
            List<List<Embedding>> vectors = new ArrayList<>();

            for (int w = 0; w < workers; w++) {
                Random random = new Random(100 + w);
                List<Embedding> own = new ArrayList<>(perWorker);
                for (int i = 0; i < perWorker; i++) {
                    own.add(randomVector(random, DIMENSION));
                }
                vectors.add(own);
            }
            for (int w = 0; w < workers; w++) {
                int worker = w;
                pool.submit(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < perWorker; i++) {
                            concurrent.insert("W" + worker + ":" + i, "n", vectors.get(worker).get(i));
                        }
                    } catch (Throwable t) {
                        errors.add(t);
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(2, TimeUnit.MINUTES));

            assertTrue(errors.isEmpty(), () -> "errors: " + errors);
            assertEquals(workers * perWorker, concurrent.size());
            assertEquals(workers * perWorker, concurrent.nodeCount());

            int selfFound = 0;
            int queried = 0;
            for (int w = 0; w < workers; w++) {
                for (int i = 0; i < perWorker; i += 125) {
                    queried++;
                    List<SemanticHit> hits = concurrent.query(vectors.get(w).get(i), 0.0, 1).hits();
                    if (!hits.isEmpty() && hits.get(0).identifier().equals("W" + w + ":" + i)) {
                        selfFound++;
                    }
                }
            }
            assertTrue(selfFound >= queried * 0.9, "self found " + selfFound + "/" + queried);
        }

        @Test
        @DisplayName("Concurrent replacement of one identifier should leave exactly one live entry")
        void concurrentReplace() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            for (int w = 0; w < 4; w++) {
                int worker = w;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        index.insert("A:1", "v" + worker, axis((worker + i) % DIMENSION));
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(1, TimeUnit.MINUTES));

            assertEquals(1, index.size());
            Set<String> identifiers = new HashSet<>();
            for (int axis = 0; axis < DIMENSION; axis++) {
                index.query(axis(axis), -1.0, 10).hits().forEach(h -> identifiers.add(h.identifier()));
            }
            assertEquals(Set.of("A:1"), identifiers);
            for (int axis = 0; axis < DIMENSION; axis++) {
                assertTrue(index.query(axis(axis), -1.0, 10).size() <= 1);
            }
        }
    }
}
