package com.entity.semantic.embedding;

import com.entity.semantic.core.model.Embedding;
import com.entity.semantic.metrics.MetricsService;
import com.entity.semantic.metrics.NoOpMetricsService;
import com.entity.semantic.tracing.NoOpTracingService;
import com.entity.semantic.tracing.Span;
import com.entity.semantic.tracing.TracedOperation;
import com.entity.semantic.tracing.TracingService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns canonical names into embeddings through an {@link EmbeddingModel}.
 *
 * <p>Names are deduplicated, served from a Caffeine cache when possible, and the misses
 * are sent to the model in batches of {@link EmbeddingOptions#getBatchSize()} on a
 * dedicated pool. A failing batch is retried item by item so that one bad name only
 * fails its own slot. The result list always has one entry per input, in input order.</p>
 *
 * <p>The provider owns the model and closes it in {@link #close()}.</p>
 */
public class EmbeddingProvider implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingProvider.class);
    static final String CLOSED = "embedding provider is closed";

    private final EmbeddingModel model;
    private final EmbeddingOptions options;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Cache<String, Embedding> cache;
    private final ExecutorService executor;
    private volatile boolean closed;

    public EmbeddingProvider(EmbeddingModel model) {
        this(model, EmbeddingOptions.defaults(), new NoOpMetricsService(), new NoOpTracingService());
    }

    public EmbeddingProvider(EmbeddingModel model, EmbeddingOptions options,
                             MetricsService metrics, TracingService tracing) {
        if (model == null) {
            throw new IllegalArgumentException("model is required");
        }
        this.model = model;
        this.options = options != null ? options : EmbeddingOptions.defaults();
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.tracing = tracing != null ? tracing : new NoOpTracingService();

        EmbeddingCacheConfig cacheConfig = this.options.getCacheConfig();
        if (cacheConfig.enabled()) {
            this.cache = Caffeine.newBuilder()
                    .maximumSize(cacheConfig.maxSize())
                    .expireAfterWrite(Duration.ofSeconds(cacheConfig.ttlSeconds()))
                    .build();
        } else {
            this.cache = null;
        }
        this.executor = Executors.newFixedThreadPool(this.options.getThreads(), new EmbedThreadFactory());

        log.info("EmbeddingProvider initialized: model={}, dimension={}, {}",
                model.getModelName(), model.dimension(), this.options);
    }

    /**
     * Embeds one name.
     */
    public EmbeddingResult embed(String name) {
        return embedBatch(List.of(name == null ? "" : name)).get(0);
    }

    /**
     * Embeds a batch of names. Null or blank names fail their slot without reaching the model.
     * After {@link #close()} every slot fails with a non-retryable result.
     *
     * @return one result per input, in input order
     */
    public List<EmbeddingResult> embedBatch(List<String> names) {
        if (names.isEmpty()) {
            return List.of();
        }
        EmbeddingResult[] results = new EmbeddingResult[names.size()];
        Map<String, List<Integer>> misses = new LinkedHashMap<>();
        int hits = 0;

        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (closed) {
                results[i] = EmbeddingResult.failure(name, CLOSED, false);
                metrics.incrementEmbeddingFailure();
                continue;
            }
            if (name == null || name.isBlank()) {
                results[i] = EmbeddingResult.failure(name, "blank name", false);
                metrics.incrementEmbeddingFailure();
                continue;
            }
            Embedding cached = cache != null ? cache.getIfPresent(name) : null;
            if (cached != null) {
                results[i] = EmbeddingResult.success(name, cached);
                metrics.recordCacheHit();
                hits++;
            } else {
                if (cache != null) {
                    metrics.recordCacheMiss();
                }
                misses.computeIfAbsent(name, k -> new ArrayList<>()).add(i);
            }
        }

        if (!misses.isEmpty()) {
            try (Span span = tracing.start(TracedOperation.EMBED_BATCH, model.getModelName())) {
                span.count("size", names.size());
                span.count("cache_hits", hits);
                span.count("distinct", misses.size());

                Map<String, EmbeddingResult> embedded = embedDistinct(new ArrayList<>(misses.keySet()));
                long failures = 0;
                for (Map.Entry<String, List<Integer>> miss : misses.entrySet()) {
                    EmbeddingResult result = embedded.get(miss.getKey());
                    if (result.isSuccess() && cache != null) {
                        cache.put(miss.getKey(), result.embedding());
                    }
                    if (!result.isSuccess()) {
                        failures += miss.getValue().size();
                        for (int k = 0; k < miss.getValue().size(); k++) {
                            metrics.incrementEmbeddingFailure();
                        }
                    }
                    for (int index : miss.getValue()) {
                        results[index] = result;
                    }
                }
                span.count("failures", failures);
                span.outcome(failures == 0 ? "EMBEDDED" : "PARTIAL_FAILURE", failures > 0);
            }
        }
        return Arrays.asList(results);
    }

    private Map<String, EmbeddingResult> embedDistinct(List<String> distinct) {
        int batchSize = options.getBatchSize();
        List<List<String>> chunks = new ArrayList<>();
        for (int from = 0; from < distinct.size(); from += batchSize) {
            chunks.add(distinct.subList(from, Math.min(from + batchSize, distinct.size())));
        }

        Map<String, EmbeddingResult> results = new HashMap<>();
        if (chunks.size() == 1) {
            results.putAll(embedChunk(chunks.get(0)));
            return results;
        }

        List<Future<Map<String, EmbeddingResult>>> futures = new ArrayList<>(chunks.size());
        for (List<String> chunk : chunks) {
            try {
                futures.add(executor.submit(() -> embedChunk(chunk)));
            } catch (RejectedExecutionException e) {
                log.warn("embed.chunk_rejected size={}", chunk.size());
                futures.add(null);
            }
        }

        for (int c = 0; c < chunks.size(); c++) {
            Future<Map<String, EmbeddingResult>> future = futures.get(c);
            if (future == null) {
                failChunk(results, chunks.get(c), CLOSED, false);
                continue;
            }
            try {
                results.putAll(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failChunk(results, chunks.get(c), "interrupted", true);
            } catch (ExecutionException e) {
                log.warn("embed.chunk_failed size={} error={}", chunks.get(c).size(), e.getCause().toString());
                failChunk(results, chunks.get(c), String.valueOf(e.getCause().getMessage()), false);
            }
        }
        return results;
    }

    private Map<String, EmbeddingResult> embedChunk(List<String> chunk) {
        Map<String, EmbeddingResult> results = new HashMap<>();
        try {
            List<float[]> vectors = callModel(chunk);
            for (int i = 0; i < chunk.size(); i++) {
                results.put(chunk.get(i), toResult(chunk.get(i), vectors.get(i)));
            }
            return results;
        } catch (EmbeddingException e) {
            if (chunk.size() == 1) {
                results.put(chunk.get(0), EmbeddingResult.failure(chunk.get(0), e.getMessage(), e.isRetryable()));
                return results;
            }
            log.warn("embed.batch_failed size={} error={}; isolating items", chunk.size(), e.getMessage());
        }

        for (String name : chunk) {
            try {
                results.put(name, toResult(name, callModel(List.of(name)).get(0)));
            } catch (EmbeddingException e) {
                log.debug("embed.item_failed name='{}' error={}", name, e.getMessage());
                results.put(name, EmbeddingResult.failure(name, e.getMessage(), e.isRetryable()));
            }
        }
        return results;
    }

    /**
     * Calls the model, retrying retryable failures with linear backoff.
     * Any other runtime failure of the model is reported as non-retryable.
     */
    private List<float[]> callModel(List<String> texts) {
        int attempt = 0;
        while (true) {
            long start = System.nanoTime();
            try {
                List<float[]> vectors = model.embedAll(texts);
                metrics.recordEmbeddingBatch(texts.size(), Duration.ofNanos(System.nanoTime() - start));
                if (vectors == null || vectors.size() != texts.size()) {
                    throw new EmbeddingException("Model returned "
                            + (vectors == null ? 0 : vectors.size()) + " vectors for "
                            + texts.size() + " inputs", false);
                }
                return vectors;
            } catch (EmbeddingException e) {
                if (!e.isRetryable() || attempt >= options.getMaxRetries()) {
                    throw e;
                }
                attempt++;
                log.debug("embed.retry attempt={} size={} error={}", attempt, texts.size(), e.getMessage());
                sleepBackoff(attempt);
            } catch (RuntimeException e) {
                throw new EmbeddingException("Model failure: " + e, e, false);
            }
        }
    }

    private void sleepBackoff(int attempt) {
        try {
            Thread.sleep(options.getRetryBackoffMs() * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted during retry backoff", e, true);
        }
    }

    private EmbeddingResult toResult(String name, float[] vector) {
        if (vector == null) {
            return EmbeddingResult.failure(name, "model returned no vector", false);
        }
        for (float v : vector) {
            if (!Float.isFinite(v)) {
                return EmbeddingResult.failure(name, "model returned a non-finite component", false);
            }
        }
        return EmbeddingResult.success(name, Embedding.of(vector));
    }

    private static void failChunk(Map<String, EmbeddingResult> results, List<String> chunk,
                                  String message, boolean retryable) {
        for (String name : chunk) {
            results.put(name, EmbeddingResult.failure(name, message, retryable));
        }
    }

    /**
     * Dimension of the vectors this provider produces.
     */
    public int dimension() {
        return model.dimension();
    }

    public EmbeddingModel getModel() {
        return model;
    }

    public boolean isAvailable() {
        return model.isAvailable();
    }

    public long cachedNames() {
        return cache != null ? cache.estimatedSize() : 0;
    }

    public void invalidateCache() {
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    @Override
    public void close() {
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        model.close();
        log.info("EmbeddingProvider closed: model={}", model.getModelName());
    }

    private static final class EmbedThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "semantic-embed-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
