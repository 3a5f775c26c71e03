package com.entity.semantic.cdi;

import com.entity.semantic.api.SemanticCandidateService;
import com.entity.semantic.embedding.CharacterNGramEmbeddingModel;
import com.entity.semantic.embedding.EmbeddingCacheConfig;
import com.entity.semantic.embedding.EmbeddingModel;
import com.entity.semantic.embedding.EmbeddingOptions;
import com.entity.semantic.embedding.OllamaEmbeddingModel;
import com.entity.semantic.index.HnswConfig;
import com.entity.semantic.index.VectorIndex;
import com.entity.semantic.pipeline.PipelineOptions;
import com.entity.semantic.store.DurableStore;
import com.entity.semantic.store.InMemoryDurableStore;
import com.entity.semantic.store.JsonLinesDurableStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the semantic candidate library from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus), it reads
 * configuration from {@code application.yaml} and produces a ready
 * {@link SemanticCandidateService}.</p>
 *
 * <h2>Example configuration</h2>
 * <pre>
 * semantic-candidates:
 *   embedding:
 *     provider: ollama
 *     dimension: 384
 *     ollama:
 *       base-url: http://localhost:11434
 *       model: all-minilm
 *   index:
 *     m: 16
 *     ef-construction: 200
 *     ef-search: 100
 *   query:
 *     threshold: 0.75
 *     limit: 10
 *   store:
 *     type: jsonl
 *     path: /var/lib/semantic/index.jsonl
 * </pre>
 *
 * <pre>
 * &#64;Inject SemanticCandidateService service;
 * </pre>
 */
@ApplicationScoped
public class SemanticCandidateProducer {

    private static final Logger log = LoggerFactory.getLogger(SemanticCandidateProducer.class);

    // ── Embedding ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "semantic-candidates.embedding.provider", defaultValue = "ollama")
    String embeddingProvider;

    @Inject
    @ConfigProperty(name = "semantic-candidates.embedding.dimension", defaultValue = "384")
    int dimension;

    @Inject
    @ConfigProperty(name = "semantic-candidates.embedding.ollama.base-url", defaultValue = "http://localhost:11434")
    String ollamaBaseUrl;

    @Inject
    @ConfigProperty(name = "semantic-candidates.embedding.ollama.model", defaultValue = "all-minilm")
    String ollamaModel;

    @Inject
    @ConfigProperty(name = "semantic-candidates.embedding.ollama.timeout-seconds", defaultValue = "30")
    int ollamaTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "semantic-candidates.embedding.batch-size", defaultValue = "32")
    int batchSize;

    @Inject
    @ConfigProperty(name = "semantic-candidates.embedding.threads", defaultValue = "4")
    int embeddingThreads;

    @Inject
    @ConfigProperty(name = "semantic-candidates.embedding.max-retries", defaultValue = "2")
    int maxRetries;

    // ── Embedding Cache ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "semantic-candidates.embedding.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "semantic-candidates.embedding.cache.max-size", defaultValue = "50000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "semantic-candidates.embedding.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    // ── HNSW Index ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "semantic-candidates.index.m", defaultValue = "16")
    int m;

    @Inject
    @ConfigProperty(name = "semantic-candidates.index.ef-construction", defaultValue = "200")
    int efConstruction;

    @Inject
    @ConfigProperty(name = "semantic-candidates.index.ef-search", defaultValue = "100")
    int efSearch;

    // ── Query ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "semantic-candidates.query.threshold", defaultValue = "0.75")
    double threshold;

    @Inject
    @ConfigProperty(name = "semantic-candidates.query.limit", defaultValue = "10")
    int limit;

    @Inject
    @ConfigProperty(name = "semantic-candidates.query.timeout-millis", defaultValue = "5000")
    long queryTimeoutMillis;

    @Inject
    @ConfigProperty(name = "semantic-candidates.pipeline.worker-threads", defaultValue = "8")
    int workerThreads;

    // ── Durable Store ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "semantic-candidates.store.type", defaultValue = "none")
    String storeType;

    @Inject
    @ConfigProperty(name = "semantic-candidates.store.path")
    Optional<String> storePath;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public SemanticCandidateService semanticCandidateService() {
        EmbeddingModel model = createEmbeddingModel();
        log.info("Producing SemanticCandidateService: model={} dimension={} store={}",
                model.getModelName(), model.dimension(), storeType);

        EmbeddingOptions embeddingOptions = EmbeddingOptions.builder()
                .batchSize(batchSize)
                .threads(embeddingThreads)
                .maxRetries(maxRetries)
                .cacheConfig(cacheEnabled
                        ? new EmbeddingCacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                        : EmbeddingCacheConfig.disabled())
                .build();

        HnswConfig hnswConfig = HnswConfig.builder()
                .dimension(model.dimension())
                .m(m)
                .efConstruction(efConstruction)
                .efSearch(efSearch)
                .build();

        PipelineOptions pipelineOptions = PipelineOptions.builder()
                .threshold(threshold)
                .limit(limit)
                .queryTimeout(Duration.ofMillis(queryTimeoutMillis))
                .workerThreads(workerThreads)
                .build();

        return SemanticCandidateService.builder()
                .embeddingModel(model)
                .embeddingOptions(embeddingOptions)
                .hnswConfig(hnswConfig)
                .pipelineOptions(pipelineOptions)
                .durableStore(createDurableStore())
                .build();
    }

    public void closeService(@Disposes SemanticCandidateService service) {
        log.info("Closing SemanticCandidateService");
        service.close();
    }

    @Produces
    @ApplicationScoped
    public VectorIndex vectorIndex(SemanticCandidateService service) {
        return service.getIndex();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    EmbeddingModel createEmbeddingModel() {
        if ("ollama".equalsIgnoreCase(embeddingProvider)) {
            return OllamaEmbeddingModel.builder()
                    .baseUrl(ollamaBaseUrl)
                    .model(ollamaModel)
                    .dimension(dimension)
                    .timeout(Duration.ofSeconds(ollamaTimeoutSeconds))
                    .build();
        }
        if (!"ngram".equalsIgnoreCase(embeddingProvider)) {
            log.warn("Unknown embedding provider '{}', falling back to character n-grams", embeddingProvider);
        }
        return new CharacterNGramEmbeddingModel(dimension);
    }

    DurableStore createDurableStore() {
        if ("jsonl".equalsIgnoreCase(storeType)) {
            String path = storePath.orElseThrow(() ->
                    new IllegalStateException("semantic-candidates.store.path is required for store type jsonl"));
            return new JsonLinesDurableStore(Path.of(path));
        }
        if ("memory".equalsIgnoreCase(storeType)) {
            return new InMemoryDurableStore();
        }
        if (!"none".equalsIgnoreCase(storeType)) {
            log.warn("Unknown store type '{}', running without a durable store", storeType);
        }
        return null;
    }
}
