package com.entity.semantic.store;

import com.entity.semantic.core.model.IndexEntry;
import com.entity.semantic.index.SemanticIndexException;
import com.entity.semantic.index.VectorIndex;
import com.entity.semantic.logging.LogContext;
import com.entity.semantic.tracing.NoOpTracingService;
import com.entity.semantic.tracing.Span;
import com.entity.semantic.tracing.TracedOperation;
import com.entity.semantic.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;

/**
 * Reconstructs a vector index by replaying every entry of a {@link DurableStore}, then
 * marks the index ready. Entries the index rejects are logged and counted; the rest of
 * the replay continues.
 */
public class IndexRebuilder {
    private static final Logger log = LoggerFactory.getLogger(IndexRebuilder.class);
    private static final int PROGRESS_INTERVAL = 10_000;

    private final TracingService tracing;

    public IndexRebuilder() {
        this(new NoOpTracingService());
    }

    public IndexRebuilder(TracingService tracing) {
        this.tracing = tracing != null ? tracing : new NoOpTracingService();
    }

    public RebuildResult rebuild(DurableStore store, VectorIndex index) {
        long start = System.nanoTime();
        long loaded = 0;
        long rejected = 0;

        try (LogContext ctx = LogContext.forRebuild(store.getName());
             Span span = tracing.start(TracedOperation.REBUILD, store.getName())) {
            log.info("rebuild.started store={} storedEntries={}", store.getName(), store.size());

            Iterator<IndexEntry> entries = store.scan();
            while (entries.hasNext()) {
                IndexEntry entry = entries.next();
                try {
                    index.insert(entry);
                    loaded++;
                } catch (SemanticIndexException e) {
                    rejected++;
                    log.warn("rebuild.rejected identifier={} error={}", entry.identifier(), e.getMessage());
                }
                if ((loaded + rejected) % PROGRESS_INTERVAL == 0) {
                    log.info("rebuild.progress replayed={}", loaded + rejected);
                }
            }
            index.markReady();

            span.count("loaded", loaded);
            span.count("rejected", rejected);
            span.outcome(rejected == 0 ? "COMPLETED" : "REJECTED_ENTRIES", rejected > 0);

            RebuildResult result = new RebuildResult(loaded, rejected, Duration.ofNanos(System.nanoTime() - start));
            log.info("rebuild.completed loaded={} rejected={} durationMs={}",
                    loaded, rejected, result.duration().toMillis());
            return result;
        }
    }
}
