package com.entity.semantic.pipeline;

import com.entity.semantic.core.model.Candidate;
import com.entity.semantic.core.model.CandidateSet;
import com.entity.semantic.core.model.SemanticHit;
import com.entity.semantic.embedding.EmbeddingProvider;
import com.entity.semantic.embedding.EmbeddingResult;
import com.entity.semantic.extract.NameExtractor;
import com.entity.semantic.index.IndexUnavailableException;
import com.entity.semantic.index.QueryResult;
import com.entity.semantic.index.VectorIndex;
import com.entity.semantic.logging.LogContext;
import com.entity.semantic.merge.CandidateMerger;
import com.entity.semantic.metrics.MetricsService;
import com.entity.semantic.tracing.Span;
import com.entity.semantic.tracing.TracedOperation;
import com.entity.semantic.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Extracts, embeds and queries search records, then merges the semantic hits with the
 * caller's exact candidates.
 *
 * <p>Every failure degrades to the exact candidates plus a {@link PipelineError}. While the
 * index is still initializing, queries are retried with linear backoff up to
 * {@link PipelineOptions#getUnavailableRetries()} times.</p>
 */
public class QueryPipeline extends AbstractPipeline {
    private static final Logger log = LoggerFactory.getLogger(QueryPipeline.class);

    private final NameExtractor extractor;
    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex index;
    private final CandidateMerger merger;

    public QueryPipeline(NameExtractor extractor, EmbeddingProvider embeddingProvider, VectorIndex index,
                         CandidateMerger merger, PipelineOptions options,
                         MetricsService metrics, TracingService tracing) {
        super("semantic-query", options, metrics, tracing);
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider is required");
        this.index = Objects.requireNonNull(index, "index is required");
        this.merger = merger != null ? merger : new CandidateMerger();
    }

    public QueryOutcome search(SearchRequest request) {
        return searchBatch(List.of(request)).get(0);
    }

    /**
     * Runs a batch of searches. Names are embedded together; index queries run in parallel.
     *
     * @return one outcome per request, in input order
     */
    public List<QueryOutcome> searchBatch(List<SearchRequest> requests) {
        if (requests.isEmpty()) {
            return List.of();
        }
        long start = System.nanoTime();

        List<String> names = new ArrayList<>(requests.size());
        List<String> toEmbed = new ArrayList<>();
        for (SearchRequest request : requests) {
            String name = extractor.extract(request.record()).orElse(null);
            names.add(name);
            if (name != null) {
                toEmbed.add(name);
            }
        }
        List<EmbeddingResult> embedded = embeddingProvider.embedBatch(toEmbed);

        List<Callable<QueryOutcome>> tasks = new ArrayList<>(requests.size());
        int next = 0;
        for (int i = 0; i < requests.size(); i++) {
            SearchRequest request = requests.get(i);
            String name = names.get(i);
            EmbeddingResult embedding = name != null ? embedded.get(next++) : null;
            tasks.add(() -> run(request, name, embedding, start));
        }
        List<QueryOutcome> outcomes = runAll(tasks, e -> {
            log.error("query.worker_failed error={}", e.toString());
            return null;
        });

        List<QueryOutcome> result = new ArrayList<>(outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            QueryOutcome outcome = outcomes.get(i);
            if (outcome == null) {
                SearchRequest request = requests.get(i);
                PipelineError error = new PipelineError(request.requestId(), PipelineStage.QUERIED,
                        ErrorKind.INTERNAL, "worker failed", true);
                outcome = QueryOutcome.failed(QueryStatus.QUERY_FAILED, names.get(i), request.exactCandidates(), error);
                metrics.recordQuery(outcome.status(), Duration.ofNanos(elapsedSince(start)));
            }
            result.add(outcome);
        }
        return result;
    }

    private QueryOutcome run(SearchRequest request, String name, EmbeddingResult embedding, long start) {
        String requestId = request.requestId();
        CandidateSet exact = request.exactCandidates();

        try (LogContext ctx = LogContext.forQuery(requestId);
             Span span = tracing.start(TracedOperation.QUERY, requestId)) {
            QueryOutcome outcome;
            if (name == null) {
                log.debug("query.no_name_skip exact={}", exact.size());
                outcome = QueryOutcome.skipped(requestId, exact);
            } else if (!embedding.isSuccess()) {
                PipelineError error = PipelineErrors.embedding(requestId, embedding);
                log.warn("query.embed_failed name='{}' error={}", name, error.message());
                outcome = QueryOutcome.failed(QueryStatus.EMBED_FAILED, name, exact, error);
            } else {
                outcome = query(request, name, embedding);
            }

            span.count("candidates", outcome.candidates().size());
            span.count("hits", outcome.semanticHits());
            span.outcome(outcome.status().name(), outcome.status().isError());
            metrics.recordQuery(outcome.status(), Duration.ofNanos(elapsedSince(start)));
            return outcome;
        }
    }

    private QueryOutcome query(SearchRequest request, String name, EmbeddingResult embedding) {
        String requestId = request.requestId();
        double threshold = request.threshold() != null ? request.threshold() : options.getThreshold();
        int limit = request.limit() != null ? request.limit() : options.getLimit();

        QueryResult result;
        try {
            result = queryWithRetry(embedding, threshold, limit);
        } catch (RuntimeException e) {
            PipelineError error = PipelineErrors.fromException(requestId, PipelineStage.QUERIED, e);
            log.warn("query.index_failed name='{}' kind={} error={}", name, error.kind(), error.message());
            return QueryOutcome.failed(QueryStatus.QUERY_FAILED, name, request.exactCandidates(), error);
        }
        if (result.truncated()) {
            log.warn("query.truncated name='{}' hits={} visited={}", name, result.size(), result.visited());
        }

        List<SemanticHit> hits = result.hits();
        CandidateSet merged = merger.merge(request.exactCandidates(), hits);
        hits.forEach(hit -> metrics.recordSimilarityScore(hit.similarity()));
        for (Candidate candidate : merged.candidates()) {
            metrics.incrementCandidate(candidate.provenance());
        }
        log.debug("query.merged name='{}' hits={} candidates={}", name, hits.size(), merged.size());
        return QueryOutcome.merged(requestId, name, merged, hits.size(), result.truncated());
    }

    private QueryResult queryWithRetry(EmbeddingResult embedding, double threshold, int limit) {
        int attempt = 0;
        while (true) {
            Instant deadline = options.getQueryTimeout() != null
                    ? Instant.now().plus(options.getQueryTimeout())
                    : null;
            try {
                return index.query(embedding.embedding(), threshold, limit, deadline);
            } catch (IndexUnavailableException e) {
                if (attempt >= options.getUnavailableRetries()) {
                    throw e;
                }
                attempt++;
                log.debug("query.index_unavailable attempt={}", attempt);
                try {
                    Thread.sleep(options.getUnavailableBackoffMs() * attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    public VectorIndex getIndex() {
        return index;
    }
}
