package com.entity.semantic.api;

import com.entity.semantic.augment.SemanticFeatureAugmenter;
import com.entity.semantic.core.model.CandidateSet;
import com.entity.semantic.core.model.SourceRecord;
import com.entity.semantic.embedding.EmbeddingModel;
import com.entity.semantic.embedding.EmbeddingOptions;
import com.entity.semantic.embedding.EmbeddingProvider;
import com.entity.semantic.engine.CandidateScorer;
import com.entity.semantic.engine.ExactCandidateSource;
import com.entity.semantic.extract.NameExtractor;
import com.entity.semantic.health.EmbeddingModelHealthCheck;
import com.entity.semantic.health.HealthCheck;
import com.entity.semantic.health.HealthCheckRegistry;
import com.entity.semantic.health.HealthStatus;
import com.entity.semantic.health.VectorIndexHealthCheck;
import com.entity.semantic.index.HnswConfig;
import com.entity.semantic.index.HnswVectorIndex;
import com.entity.semantic.index.VectorIndex;
import com.entity.semantic.merge.CandidateMerger;
import com.entity.semantic.metrics.MetricsService;
import com.entity.semantic.metrics.NoOpMetricsService;
import com.entity.semantic.pipeline.ErrorKind;
import com.entity.semantic.pipeline.IngestionOutcome;
import com.entity.semantic.pipeline.IngestionPipeline;
import com.entity.semantic.pipeline.PipelineError;
import com.entity.semantic.pipeline.PipelineOptions;
import com.entity.semantic.pipeline.PipelineStage;
import com.entity.semantic.pipeline.QueryOutcome;
import com.entity.semantic.pipeline.QueryPipeline;
import com.entity.semantic.pipeline.QueryStatus;
import com.entity.semantic.pipeline.SearchRequest;
import com.entity.semantic.store.DurableStore;
import com.entity.semantic.store.IndexRebuilder;
import com.entity.semantic.store.RebuildResult;
import com.entity.semantic.tracing.NoOpTracingService;
import com.entity.semantic.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point of the semantic candidate library.
 * Wires the name extractor, embedding provider, vector index, durable store and both
 * pipelines behind one object.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * SemanticCandidateService service = SemanticCandidateService.builder()
 *     .embeddingModel(OllamaEmbeddingModel.createDefault())
 *     .durableStore(new JsonLinesDurableStore(Path.of("data/index.jsonl")))
 *     .exactCandidateSource(phoneticMatcher)
 *     .build();
 *
 * service.ingest(SourceRecord.fromMap(Map.of(
 *     "DATA_SOURCE", "CUSTOMERS", "RECORD_ID", "1001", "NAME_FULL", "Robert Johnson")));
 *
 * QueryOutcome outcome = service.search(searchRecord);
 * outcome.candidates().candidates().forEach(c -&gt; ...);
 * </pre>
 *
 * <p>When a durable store is configured and no index is supplied, the service starts with
 * an initializing index, replays the store into it and marks it ready before returning
 * from {@link Builder#build()}.</p>
 */
public class SemanticCandidateService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SemanticCandidateService.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex index;
    private final DurableStore store;
    private final IngestionPipeline ingestionPipeline;
    private final QueryPipeline queryPipeline;
    private final ExactCandidateSource exactCandidateSource;
    private final CandidateScorer candidateScorer;
    private final SemanticFeatureAugmenter augmenter;
    private final IndexRebuilder rebuilder;
    private final HealthCheckRegistry healthCheckRegistry;

    private SemanticCandidateService(Builder builder) {
        MetricsService metrics = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        NameExtractor extractor = builder.nameExtractor != null
                ? builder.nameExtractor : new NameExtractor();

        this.embeddingProvider = new EmbeddingProvider(builder.embeddingModel, builder.embeddingOptions,
                metrics, tracing);
        this.store = builder.durableStore;

        if (builder.vectorIndex != null) {
            this.index = builder.vectorIndex;
        } else {
            HnswConfig config = builder.hnswConfig != null
                    ? builder.hnswConfig : HnswConfig.withDimension(builder.embeddingModel.dimension());
            this.index = store != null ? HnswVectorIndex.initializing(config) : new HnswVectorIndex(config);
        }
        if (index.dimension() != builder.embeddingModel.dimension()) {
            throw new IllegalStateException("Index dimension " + index.dimension()
                    + " does not match embedding model dimension " + builder.embeddingModel.dimension());
        }
        metrics.registerIndex(index);

        this.ingestionPipeline = new IngestionPipeline(extractor, embeddingProvider, index, store,
                builder.pipelineOptions, metrics, tracing);
        this.queryPipeline = new QueryPipeline(extractor, embeddingProvider, index,
                builder.candidateMerger, builder.pipelineOptions, metrics, tracing);
        this.exactCandidateSource = builder.exactCandidateSource != null
                ? builder.exactCandidateSource : ExactCandidateSource.NONE;
        this.candidateScorer = builder.candidateScorer;
        this.augmenter = new SemanticFeatureAugmenter(extractor, embeddingProvider);
        this.rebuilder = new IndexRebuilder(tracing);

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new VectorIndexHealthCheck(index));
        healthCheckRegistry.register(new EmbeddingModelHealthCheck(builder.embeddingModel));
        builder.healthChecks.forEach(healthCheckRegistry::register);

        if (store != null && builder.rebuildOnStart) {
            rebuildFromStore();
        } else if (!index.isReady() && store == null) {
            index.markReady();
        }

        log.info("SemanticCandidateService initialized: model={}, dimension={}, store={}, entries={}",
                builder.embeddingModel.getModelName(), index.dimension(),
                store != null ? store.getName() : "none", index.size());
    }

    // ========== Ingestion API ==========

    public IngestionOutcome ingest(SourceRecord record) {
        return ingestionPipeline.ingest(record);
    }

    public List<IngestionOutcome> ingestAll(List<SourceRecord> records) {
        return ingestionPipeline.ingestBatch(records);
    }

    /**
     * Removes a record's entry from the index and the durable store.
     */
    public boolean delete(String identifier) {
        return ingestionPipeline.delete(identifier);
    }

    // ========== Search API ==========

    /**
     * Searches with the exact candidates of the configured {@link ExactCandidateSource}.
     * A failing source ends the search in {@link QueryStatus#QUERY_FAILED} with an
     * {@link ErrorKind#INTERNAL} error and no candidates.
     */
    public QueryOutcome search(SourceRecord record) {
        CandidateSet exact;
        try {
            exact = exactCandidateSource.candidatesFor(record);
        } catch (RuntimeException e) {
            log.warn("search.exact_source_failed identifier={} error={}", record.identifier(), e.toString());
            PipelineError error = new PipelineError(record.identifier(), PipelineStage.RECEIVED,
                    ErrorKind.INTERNAL, "exact candidate source failed: " + e.getMessage(), false);
            return QueryOutcome.failed(QueryStatus.QUERY_FAILED, null, CandidateSet.empty(), error);
        }
        return queryPipeline.search(SearchRequest.of(record, exact));
    }

    public QueryOutcome search(SearchRequest request) {
        return queryPipeline.search(request);
    }

    public List<QueryOutcome> searchAll(List<SearchRequest> requests) {
        return queryPipeline.searchBatch(requests);
    }

    /**
     * Generates candidates for the record and hands them to the configured
     * {@link CandidateScorer}.
     *
     * @throws IllegalStateException if no scorer is configured
     */
    public ResolutionResult resolve(SourceRecord record) {
        if (candidateScorer == null) {
            throw new IllegalStateException("No CandidateScorer configured");
        }
        QueryOutcome outcome = search(record);
        return new ResolutionResult(outcome, candidateScorer.score(record, outcome.candidates()));
    }

    /**
     * Copies the record with inline semantic features added.
     *
     * @see SemanticFeatureAugmenter
     */
    public SourceRecord augment(SourceRecord record) {
        return augmenter.augment(record);
    }

    // ========== Maintenance ==========

    /**
     * Replays the durable store into the index and marks the index ready.
     *
     * @throws IllegalStateException if no store is configured
     */
    public RebuildResult rebuildFromStore() {
        if (store == null) {
            throw new IllegalStateException("No DurableStore configured");
        }
        return rebuilder.rebuild(store, index);
    }

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    // ========== Component Access ==========

    public VectorIndex getIndex() {
        return index;
    }

    public EmbeddingProvider getEmbeddingProvider() {
        return embeddingProvider;
    }

    public Optional<DurableStore> getDurableStore() {
        return Optional.ofNullable(store);
    }

    public IngestionPipeline getIngestionPipeline() {
        return ingestionPipeline;
    }

    public QueryPipeline getQueryPipeline() {
        return queryPipeline;
    }

    @Override
    public void close() {
        ingestionPipeline.close();
        queryPipeline.close();
        embeddingProvider.close();
        if (store != null) {
            try {
                store.close();
            } catch (RuntimeException e) {
                log.warn("Error closing durable store {}", store.getName(), e);
            }
        }
        log.info("SemanticCandidateService closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EmbeddingModel embeddingModel;
        private EmbeddingOptions embeddingOptions = EmbeddingOptions.defaults();
        private HnswConfig hnswConfig;
        private VectorIndex vectorIndex;
        private DurableStore durableStore;
        private boolean rebuildOnStart = true;
        private PipelineOptions pipelineOptions = PipelineOptions.defaults();
        private NameExtractor nameExtractor;
        private CandidateMerger candidateMerger;
        private ExactCandidateSource exactCandidateSource;
        private CandidateScorer candidateScorer;
        private MetricsService metricsService;
        private TracingService tracingService;
        private final List<HealthCheck> healthChecks = new ArrayList<>();

        /**
         * Sets the embedding model. Required. The service takes ownership and closes it.
         */
        public Builder embeddingModel(EmbeddingModel embeddingModel) {
            this.embeddingModel = embeddingModel;
            return this;
        }

        public Builder embeddingOptions(EmbeddingOptions embeddingOptions) {
            this.embeddingOptions = embeddingOptions;
            return this;
        }

        /**
         * Tunables of the default HNSW index. Ignored when {@link #vectorIndex(VectorIndex)} is set.
         */
        public Builder hnswConfig(HnswConfig hnswConfig) {
            this.hnswConfig = hnswConfig;
            return this;
        }

        public Builder vectorIndex(VectorIndex vectorIndex) {
            this.vectorIndex = vectorIndex;
            return this;
        }

        /**
         * Sets the durable store ingestion writes through to. The service closes it.
         */
        public Builder durableStore(DurableStore durableStore) {
            this.durableStore = durableStore;
            return this;
        }

        /**
         * Whether to replay the durable store into the index on build. Defaults to true.
         * When false, a default index stays unavailable until {@link SemanticCandidateService#rebuildFromStore()} runs.
         */
        public Builder rebuildOnStart(boolean rebuildOnStart) {
            this.rebuildOnStart = rebuildOnStart;
            return this;
        }

        public Builder pipelineOptions(PipelineOptions pipelineOptions) {
            this.pipelineOptions = pipelineOptions;
            return this;
        }

        public Builder nameExtractor(NameExtractor nameExtractor) {
            this.nameExtractor = nameExtractor;
            return this;
        }

        public Builder candidateMerger(CandidateMerger candidateMerger) {
            this.candidateMerger = candidateMerger;
            return this;
        }

        public Builder exactCandidateSource(ExactCandidateSource exactCandidateSource) {
            this.exactCandidateSource = exactCandidateSource;
            return this;
        }

        public Builder candidateScorer(CandidateScorer candidateScorer) {
            this.candidateScorer = candidateScorer;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Registers an extra health check next to the built-in index and model checks.
         */
        public Builder healthCheck(HealthCheck healthCheck) {
            this.healthChecks.add(healthCheck);
            return this;
        }

        public SemanticCandidateService build() {
            if (embeddingModel == null) {
                throw new IllegalStateException("EmbeddingModel is required");
            }
            return new SemanticCandidateService(this);
        }
    }
}
