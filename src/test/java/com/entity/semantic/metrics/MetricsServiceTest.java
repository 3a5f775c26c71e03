package com.entity.semantic.metrics;

import com.entity.semantic.core.model.Embedding;
import com.entity.semantic.core.model.Provenance;
import com.entity.semantic.index.BruteForceVectorIndex;
import com.entity.semantic.pipeline.IngestionStatus;
import com.entity.semantic.pipeline.QueryStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordIngestion(IngestionStatus.INDEXED, Duration.ofMillis(5));
                noOp.recordQuery(QueryStatus.MERGED, Duration.ofMillis(12));
                noOp.recordEmbeddingBatch(32, Duration.ofMillis(40));
                noOp.incrementEmbeddingFailure();
                noOp.incrementCandidate(Provenance.BOTH);
                noOp.recordSimilarityScore(0.85);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
                noOp.registerIndex(new BruteForceVectorIndex(3));
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record ingestion duration as timer tagged by status")
        void recordIngestion() {
            metrics.recordIngestion(IngestionStatus.INDEXED, Duration.ofMillis(150));
            metrics.recordIngestion(IngestionStatus.INDEXED, Duration.ofMillis(250));
            metrics.recordIngestion(IngestionStatus.NO_NAME_SKIP, Duration.ofMillis(1));

            Timer timer = registry.find("semantic.ingest.duration")
                    .tag("status", "INDEXED")
                    .timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(1, registry.find("semantic.ingest.duration").tag("status", "NO_NAME_SKIP").timer().count());
        }

        @Test
        @DisplayName("Should record query duration as timer tagged by status")
        void recordQuery() {
            metrics.recordQuery(QueryStatus.QUERY_FAILED, Duration.ofMillis(30));

            Timer timer = registry.find("semantic.query.duration")
                    .tag("status", "QUERY_FAILED")
                    .timer();

            assertNotNull(timer);
            assertEquals(1, timer.count());
        }

        @Test
        @DisplayName("Should record embedding batch duration and size")
        void recordEmbeddingBatch() {
            metrics.recordEmbeddingBatch(32, Duration.ofMillis(80));
            metrics.recordEmbeddingBatch(8, Duration.ofMillis(20));

            DistributionSummary size = registry.find("semantic.embed.batch.size").summary();
            assertNotNull(size);
            assertEquals(2, size.count());
            assertEquals(40.0, size.totalAmount());
            assertEquals(2, registry.find("semantic.embed.batch.duration").timer().count());
        }

        @Test
        @DisplayName("Should count candidates by provenance")
        void incrementCandidate() {
            metrics.incrementCandidate(Provenance.SEMANTIC);
            metrics.incrementCandidate(Provenance.SEMANTIC);
            metrics.incrementCandidate(Provenance.BOTH);

            Counter semantic = registry.find("semantic.candidates").tag("provenance", "SEMANTIC").counter();
            assertNotNull(semantic);
            assertEquals(2.0, semantic.count());
            assertEquals(1.0, registry.find("semantic.candidates").tag("provenance", "BOTH").counter().count());
        }

        @Test
        @DisplayName("Should record similarity scores as distribution summary")
        void recordSimilarityScore() {
            metrics.recordSimilarityScore(0.85);
            metrics.recordSimilarityScore(0.95);

            DistributionSummary summary = registry.find("semantic.similarity.score").summary();
            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(0.90, summary.mean(), 0.001);
        }

        @Test
        @DisplayName("Should count failures and cache hits and misses")
        void counters() {
            metrics.incrementEmbeddingFailure();
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.find("semantic.embed.failures").counter().count());
            assertEquals(2.0, registry.find("semantic.embed.cache.hit").counter().count());
            assertEquals(1.0, registry.find("semantic.embed.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Index size gauge should follow the live entry count")
        void indexSizeGauge() {
            BruteForceVectorIndex index = new BruteForceVectorIndex(2);
            metrics.registerIndex(index);
            index.insert("A:1", "x", Embedding.of(1.0, 0.0));
            index.insert("A:2", "y", Embedding.of(0.0, 1.0));

            Gauge gauge = registry.find("semantic.index.size").gauge();
            assertNotNull(gauge);
            assertEquals(2.0, gauge.value());
        }
    }
}
