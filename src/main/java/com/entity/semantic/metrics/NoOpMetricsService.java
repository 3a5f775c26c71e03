package com.entity.semantic.metrics;

import com.entity.semantic.core.model.Provenance;
import com.entity.semantic.index.VectorIndex;
import com.entity.semantic.pipeline.IngestionStatus;
import com.entity.semantic.pipeline.QueryStatus;

import java.time.Duration;

/**
 * Metrics disabled.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordIngestion(IngestionStatus status, Duration duration) {
    }

    @Override
    public void recordQuery(QueryStatus status, Duration duration) {
    }

    @Override
    public void recordEmbeddingBatch(int size, Duration duration) {
    }

    @Override
    public void incrementEmbeddingFailure() {
    }

    @Override
    public void incrementCandidate(Provenance provenance) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void registerIndex(VectorIndex index) {
    }
}
