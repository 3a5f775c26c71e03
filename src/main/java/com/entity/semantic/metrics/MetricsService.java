package com.entity.semantic.metrics;

import com.entity.semantic.core.model.Provenance;
import com.entity.semantic.index.VectorIndex;
import com.entity.semantic.pipeline.IngestionStatus;
import com.entity.semantic.pipeline.QueryStatus;

import java.time.Duration;

/**
 * Records candidate-generation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library runs without any
 * metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordIngestion(IngestionStatus status, Duration duration);

    void recordQuery(QueryStatus status, Duration duration);

    void recordEmbeddingBatch(int size, Duration duration);

    void incrementEmbeddingFailure();

    void incrementCandidate(Provenance provenance);

    void recordSimilarityScore(double score);

    void recordCacheHit();

    void recordCacheMiss();

    /**
     * Exposes the live entry count of the index as a gauge.
     */
    void registerIndex(VectorIndex index);
}
