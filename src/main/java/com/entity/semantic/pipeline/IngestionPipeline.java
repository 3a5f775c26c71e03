package com.entity.semantic.pipeline;

import com.entity.semantic.core.model.IndexEntry;
import com.entity.semantic.core.model.SourceRecord;
import com.entity.semantic.embedding.EmbeddingProvider;
import com.entity.semantic.embedding.EmbeddingResult;
import com.entity.semantic.extract.NameExtractor;
import com.entity.semantic.index.VectorIndex;
import com.entity.semantic.logging.LogContext;
import com.entity.semantic.metrics.MetricsService;
import com.entity.semantic.store.DurableStore;
import com.entity.semantic.tracing.Span;
import com.entity.semantic.tracing.TracedOperation;
import com.entity.semantic.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Extracts, embeds and indexes records.
 *
 * <p>Each record ends in one {@link IngestionStatus}. Failures are returned as
 * {@link PipelineError} values and never abort sibling records. Re-ingesting an identifier
 * replaces its entry; a re-ingested record that no longer has a name loses its entry.</p>
 *
 * <p>In a batch, the names are embedded together and the distinct identifiers are indexed
 * in parallel on the worker pool. Records sharing an identifier are applied in submission
 * order, so the last one wins.</p>
 *
 * <p>When a {@link DurableStore} is configured, every indexed entry and every delete is
 * written through to it. The index write and the store write for one identifier happen under
 * the same striped lock, so concurrent batches leave the index and the store agreeing on
 * the last write.</p>
 */
public class IngestionPipeline extends AbstractPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);
    private static final int LOCK_STRIPES = 64;

    private final NameExtractor extractor;
    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex index;
    private final DurableStore store;
    private final ReentrantLock[] identifierLocks = new ReentrantLock[LOCK_STRIPES];

    public IngestionPipeline(NameExtractor extractor, EmbeddingProvider embeddingProvider, VectorIndex index,
                             DurableStore store, PipelineOptions options,
                             MetricsService metrics, TracingService tracing) {
        super("semantic-ingest", options, metrics, tracing);
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider is required");
        this.index = Objects.requireNonNull(index, "index is required");
        this.store = store;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            identifierLocks[i] = new ReentrantLock();
        }
    }

    public IngestionOutcome ingest(SourceRecord record) {
        return ingestBatch(Collections.singletonList(record)).get(0);
    }

    /**
     * Ingests a batch of records.
     *
     * @return one outcome per record, in input order
     * @throws IllegalArgumentException if the batch contains a null record; nothing is
     *                                  indexed in that case
     */
    public List<IngestionOutcome> ingestBatch(List<SourceRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i) == null) {
                throw new IllegalArgumentException("records[" + i + "] is null");
            }
        }
        long start = System.nanoTime();
        String batchId = LogContext.generateBatchId();

        try (LogContext ctx = LogContext.forBatch(batchId);
             Span span = tracing.start(TracedOperation.INGEST, batchId)) {
            span.count("size", records.size());

            // RECEIVED -> NAME_EXTRACTED
            List<String> names = new ArrayList<>(records.size());
            List<String> toEmbed = new ArrayList<>();
            for (SourceRecord record : records) {
                String name = extractor.extract(record).orElse(null);
                names.add(name);
                if (name != null) {
                    toEmbed.add(name);
                }
            }

            // NAME_EXTRACTED -> EMBEDDED
            List<EmbeddingResult> embedded = embeddingProvider.embedBatch(toEmbed);
            List<EmbeddingResult> embeddings = new ArrayList<>(records.size());
            int next = 0;
            for (String name : names) {
                embeddings.add(name != null ? embedded.get(next++) : null);
            }

            // EMBEDDED -> INDEXED, grouped by identifier so that duplicates apply in order
            Map<String, List<Integer>> byIdentifier = new LinkedHashMap<>();
            for (int i = 0; i < records.size(); i++) {
                byIdentifier.computeIfAbsent(records.get(i).identifier(), k -> new ArrayList<>()).add(i);
            }
            List<Callable<List<IngestionOutcome>>> tasks = new ArrayList<>(byIdentifier.size());
            for (List<Integer> positions : byIdentifier.values()) {
                tasks.add(() -> {
                    List<IngestionOutcome> outcomes = new ArrayList<>(positions.size());
                    for (int i : positions) {
                        outcomes.add(apply(records.get(i), names.get(i), embeddings.get(i), batchId, start));
                    }
                    return outcomes;
                });
            }
            List<List<IngestionOutcome>> grouped = runAll(tasks, e -> {
                log.error("ingest.worker_failed error={}", e.toString());
                return null;
            });

            IngestionOutcome[] outcomes = new IngestionOutcome[records.size()];
            int g = 0;
            for (List<Integer> positions : byIdentifier.values()) {
                List<IngestionOutcome> groupOutcomes = grouped.get(g++);
                for (int k = 0; k < positions.size(); k++) {
                    int i = positions.get(k);
                    outcomes[i] = groupOutcomes != null
                            ? groupOutcomes.get(k)
                            : internalFailure(records.get(i).identifier(), names.get(i), start);
                }
            }

            List<IngestionOutcome> result = List.of(outcomes);
            long failed = result.stream().filter(o -> o.status().isError()).count();
            span.count("failed", failed);
            span.outcome(failed == 0 ? "COMPLETED" : "PARTIAL_FAILURE", failed > 0);
            if (records.size() > 1) {
                log.info("ingest.batch_completed size={} failed={} durationMs={}",
                        records.size(), failed, Duration.ofNanos(elapsedSince(start)).toMillis());
            }
            return result;
        }
    }

    private IngestionOutcome apply(SourceRecord record, String name, EmbeddingResult embedding,
                                   String batchId, long start) {
        String identifier = record.identifier();
        try (LogContext ctx = LogContext.forIngestion(identifier).with("batchId", batchId)) {
            IngestionOutcome outcome;
            if (name == null) {
                outcome = skip(identifier);
            } else if (!embedding.isSuccess()) {
                PipelineError error = PipelineErrors.embedding(identifier, embedding);
                log.warn("ingest.embed_failed name='{}' error={} retryable={}",
                        name, error.message(), error.retryable());
                outcome = IngestionOutcome.failed(IngestionStatus.EMBED_FAILED, name, error);
            } else {
                outcome = index(identifier, name, embedding);
            }
            metrics.recordIngestion(outcome.status(), Duration.ofNanos(elapsedSince(start)));
            return outcome;
        }
    }

    private IngestionOutcome skip(String identifier) {
        ReentrantLock lock = lockFor(identifier);
        lock.lock();
        try {
            if (index.delete(identifier)) {
                log.info("ingest.name_removed previous entry deleted");
                if (store != null) {
                    store.delete(identifier);
                }
            }
        } catch (RuntimeException e) {
            PipelineError error = PipelineErrors.persistence(identifier, e);
            log.warn("ingest.delete_failed error={}", e.getMessage());
            return IngestionOutcome.failed(IngestionStatus.PERSIST_FAILED, null, error);
        } finally {
            lock.unlock();
        }
        log.debug("ingest.no_name_skip");
        return IngestionOutcome.skipped(identifier);
    }

    private IngestionOutcome index(String identifier, String name, EmbeddingResult embedding) {
        IndexEntry entry = new IndexEntry(identifier, name, embedding.embedding());
        ReentrantLock lock = lockFor(identifier);
        lock.lock();
        try {
            try {
                index.insert(entry);
            } catch (RuntimeException e) {
                PipelineError error = PipelineErrors.fromException(identifier, PipelineStage.INDEXED, e);
                log.warn("ingest.index_failed name='{}' kind={} error={}", name, error.kind(), error.message());
                return IngestionOutcome.failed(IngestionStatus.INDEX_FAILED, name, error);
            }
            if (store != null) {
                try {
                    store.save(entry);
                } catch (RuntimeException e) {
                    PipelineError error = PipelineErrors.persistence(identifier, e);
                    log.warn("ingest.persist_failed name='{}' error={}", name, e.getMessage());
                    return IngestionOutcome.failed(IngestionStatus.PERSIST_FAILED, name, error);
                }
            }
        } finally {
            lock.unlock();
        }
        log.debug("ingest.indexed name='{}'", name);
        return IngestionOutcome.indexed(identifier, name);
    }

    private IngestionOutcome internalFailure(String identifier, String name, long start) {
        PipelineError error = new PipelineError(identifier, PipelineStage.INDEXED, ErrorKind.INTERNAL,
                "worker failed", true);
        metrics.recordIngestion(IngestionStatus.INDEX_FAILED, Duration.ofNanos(elapsedSince(start)));
        return IngestionOutcome.failed(IngestionStatus.INDEX_FAILED, name, error);
    }

    /**
     * Removes the entry for {@code identifier} from the index and the store.
     *
     * @return true if the index held an entry
     * @throws com.entity.semantic.store.StoreException if the store delete fails
     */
    public boolean delete(String identifier) {
        try (LogContext ctx = LogContext.forIngestion(identifier).with("operation", "delete")) {
            ReentrantLock lock = lockFor(identifier);
            lock.lock();
            boolean removed;
            try {
                removed = index.delete(identifier);
                if (store != null) {
                    store.delete(identifier);
                }
            } finally {
                lock.unlock();
            }
            log.info("ingest.deleted removed={}", removed);
            return removed;
        }
    }

    private ReentrantLock lockFor(String identifier) {
        return identifierLocks[Math.floorMod(identifier.hashCode(), LOCK_STRIPES)];
    }

    public Optional<DurableStore> getStore() {
        return Optional.ofNullable(store);
    }

    public VectorIndex getIndex() {
        return index;
    }
}
