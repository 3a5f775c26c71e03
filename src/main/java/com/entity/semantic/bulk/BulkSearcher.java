package com.entity.semantic.bulk;

import com.entity.semantic.engine.ExactCandidateSource;
import com.entity.semantic.pipeline.QueryOutcome;
import com.entity.semantic.pipeline.QueryPipeline;
import com.entity.semantic.pipeline.SearchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs every record of a JSON Lines file as a search and reports latency statistics.
 * Requests run on {@code concurrency} threads with at most twice that many in flight.
 */
public class BulkSearcher {
    private static final Logger log = LoggerFactory.getLogger(BulkSearcher.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    private final QueryPipeline pipeline;
    private final ExactCandidateSource exactSource;
    private final JsonRecordReader reader;
    private final int concurrency;

    public BulkSearcher(QueryPipeline pipeline) {
        this(pipeline, ExactCandidateSource.NONE, Runtime.getRuntime().availableProcessors());
    }

    public BulkSearcher(QueryPipeline pipeline, ExactCandidateSource exactSource, int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        this.pipeline = pipeline;
        this.exactSource = exactSource != null ? exactSource : ExactCandidateSource.NONE;
        this.reader = new JsonRecordReader();
        this.concurrency = concurrency;
    }

    public SearchReport search(Path file, ProgressCallback callback) {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return search(br, callback);
        } catch (IOException e) {
            log.error("bulk.search_failed file={} error={}", file, e.getMessage());
            return new SearchReport(0, 0, 0, 0, 0, 0, 0, LatencyStats.empty(),
                    List.of(new IngestionReport.LineError(0, "", "IO error: " + e.getMessage())));
        }
    }

    public SearchReport search(Reader input, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        BufferedReader br = input instanceof BufferedReader b ? b : new BufferedReader(input);
        Tally tally = new Tally();
        long begin = System.nanoTime();

        ExecutorService executor = Executors.newFixedThreadPool(concurrency);
        try {
            Iterator<RecordLine> lines = reader.lines(br);
            List<RecordLine> window = new ArrayList<>(concurrency * 2);
            while (lines.hasNext()) {
                RecordLine line = lines.next();
                if (!line.isValid()) {
                    tally.invalid++;
                    tally.errors.add(new IngestionReport.LineError(line.lineNumber(), "", line.error()));
                    continue;
                }
                window.add(line);
                if (window.size() == concurrency * 2) {
                    runWindow(executor, window, tally, cb, begin);
                }
            }
            runWindow(executor, window, tally, cb, begin);
        } catch (UncheckedIOException e) {
            log.error("bulk.read_failed error={}", e.getCause().getMessage());
            tally.errors.add(new IngestionReport.LineError(0, "", "IO error: " + e.getCause().getMessage()));
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        SearchReport report = new SearchReport(tally.total, tally.merged, tally.skipped, tally.failed,
                tally.invalid, tally.candidates, tally.truncated, LatencyStats.of(tally.timings), tally.errors);
        cb.onProgress(tally.total, tally.total, "Search completed");
        log.info("bulk.search_completed report={}", report);
        return report;
    }

    private void runWindow(ExecutorService executor, List<RecordLine> window, Tally tally,
                           ProgressCallback cb, long begin) {
        if (window.isEmpty()) {
            return;
        }
        List<Future<Timed>> futures = new ArrayList<>(window.size());
        for (RecordLine line : window) {
            futures.add(executor.submit(() -> {
                long start = System.nanoTime();
                QueryOutcome outcome = pipeline.search(
                        SearchRequest.of(line.record(), exactSource.candidatesFor(line.record())));
                return new Timed(outcome, System.nanoTime() - start);
            }));
        }
        for (int i = 0; i < futures.size(); i++) {
            RecordLine line = window.get(i);
            try {
                tally.add(line, futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                tally.fail(line, "interrupted");
            } catch (ExecutionException e) {
                log.warn("bulk.search_error line={} error={}", line.lineNumber(), e.getCause().toString());
                tally.fail(line, e.getCause().toString());
            }
            if (tally.total % PROGRESS_INTERVAL == 0) {
                double seconds = (System.nanoTime() - begin) / 1e9;
                cb.onProgress(tally.total, -1, String.format("Processed %d searches, %.1f per second, %d candidates",
                        tally.total, tally.total / Math.max(seconds, 1e-9), tally.candidates));
            }
        }
        window.clear();
    }

    private record Timed(QueryOutcome outcome, long nanos) {}

    private static final class Tally {
        long total;
        long merged;
        long skipped;
        long failed;
        long invalid;
        long candidates;
        long truncated;
        final List<LatencyStats.Timing> timings = new ArrayList<>();
        final List<IngestionReport.LineError> errors = new ArrayList<>();

        void add(RecordLine line, Timed timed) {
            QueryOutcome outcome = timed.outcome();
            total++;
            timings.add(new LatencyStats.Timing(outcome.requestId(), timed.nanos()));
            candidates += outcome.candidates().size();
            if (outcome.truncated()) {
                truncated++;
            }
            switch (outcome.status()) {
                case MERGED -> merged++;
                case NO_NAME_SKIP -> skipped++;
                default -> {
                    failed++;
                    errors.add(new IngestionReport.LineError(line.lineNumber(), outcome.requestId(),
                            outcome.error() != null ? outcome.error().toString() : outcome.status().name()));
                }
            }
        }

        void fail(RecordLine line, String message) {
            total++;
            failed++;
            errors.add(new IngestionReport.LineError(line.lineNumber(), line.record().identifier(), message));
        }
    }
}
