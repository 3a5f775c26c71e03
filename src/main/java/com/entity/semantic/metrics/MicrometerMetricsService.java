package com.entity.semantic.metrics;

import com.entity.semantic.core.model.Provenance;
import com.entity.semantic.index.VectorIndex;
import com.entity.semantic.pipeline.IngestionStatus;
import com.entity.semantic.pipeline.QueryStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code semantic.ingest.duration}: Timer (tag: status)</li>
 *   <li>{@code semantic.query.duration}: Timer (tag: status)</li>
 *   <li>{@code semantic.embed.batch.duration}: Timer</li>
 *   <li>{@code semantic.embed.batch.size}: DistributionSummary</li>
 *   <li>{@code semantic.embed.failures}: Counter</li>
 *   <li>{@code semantic.candidates}: Counter (tag: provenance)</li>
 *   <li>{@code semantic.similarity.score}: DistributionSummary</li>
 *   <li>{@code semantic.embed.cache.hit} / {@code semantic.embed.cache.miss}: Counters</li>
 *   <li>{@code semantic.index.size}: Gauge</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<Provenance, Counter> candidateCounters = new ConcurrentHashMap<>();
    private final Timer embedBatchTimer;
    private final DistributionSummary embedBatchSize;
    private final DistributionSummary similarityScores;
    private final Counter embedFailures;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.embedBatchTimer = Timer.builder("semantic.embed.batch.duration")
                .description("Duration of embedding model batch calls")
                .register(registry);
        this.embedBatchSize = DistributionSummary.builder("semantic.embed.batch.size")
                .description("Names per embedding model batch call")
                .register(registry);
        this.similarityScores = DistributionSummary.builder("semantic.similarity.score")
                .description("Cosine similarity of semantic hits")
                .register(registry);
        this.embedFailures = Counter.builder("semantic.embed.failures")
                .description("Names the embedding model failed to embed")
                .register(registry);
        this.cacheHits = Counter.builder("semantic.embed.cache.hit")
                .description("Embedding cache hits")
                .register(registry);
        this.cacheMisses = Counter.builder("semantic.embed.cache.miss")
                .description("Embedding cache misses")
                .register(registry);
    }

    @Override
    public void recordIngestion(IngestionStatus status, Duration duration) {
        timer("semantic.ingest.duration", "Duration of record ingestion", status.name()).record(duration);
    }

    @Override
    public void recordQuery(QueryStatus status, Duration duration) {
        timer("semantic.query.duration", "Duration of semantic candidate queries", status.name()).record(duration);
    }

    @Override
    public void recordEmbeddingBatch(int size, Duration duration) {
        embedBatchTimer.record(duration);
        embedBatchSize.record(size);
    }

    @Override
    public void incrementEmbeddingFailure() {
        embedFailures.increment();
    }

    @Override
    public void incrementCandidate(Provenance provenance) {
        candidateCounters.computeIfAbsent(provenance, p ->
                Counter.builder("semantic.candidates")
                        .description("Candidates emitted, by provenance")
                        .tag("provenance", p.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScores.record(score);
    }

    @Override
    public void recordCacheHit() {
        cacheHits.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    @Override
    public void registerIndex(VectorIndex index) {
        Gauge.builder("semantic.index.size", index, VectorIndex::size)
                .description("Live entries in the vector index")
                .register(registry);
    }

    private Timer timer(String name, String description, String status) {
        return timerCache.computeIfAbsent(name + ":" + status, k ->
                Timer.builder(name)
                        .description(description)
                        .tag("status", status)
                        .register(registry));
    }
}
