package com.entity.semantic.bulk;

import com.entity.semantic.core.model.SourceRecord;
import com.entity.semantic.pipeline.IngestionOutcome;
import com.entity.semantic.pipeline.IngestionPipeline;
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

/**
 * Loads a JSON Lines file through the {@link IngestionPipeline} in chunks.
 *
 * <pre>
 * BulkIngester ingester = new BulkIngester(pipeline);
 * IngestionReport report = ingester.ingest(Path.of("customers.jsonl"),
 *         (done, total, msg) -> System.out.println(msg));
 * </pre>
 */
public class BulkIngester {
    private static final Logger log = LoggerFactory.getLogger(BulkIngester.class);
    private static final int DEFAULT_CHUNK_SIZE = 1_000;

    private final IngestionPipeline pipeline;
    private final JsonRecordReader reader;
    private final int chunkSize;

    public BulkIngester(IngestionPipeline pipeline) {
        this(pipeline, new JsonRecordReader(), DEFAULT_CHUNK_SIZE);
    }

    public BulkIngester(IngestionPipeline pipeline, JsonRecordReader reader, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        this.pipeline = pipeline;
        this.reader = reader;
        this.chunkSize = chunkSize;
    }

    public IngestionReport ingest(Path file, ProgressCallback callback) {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return ingest(br, callback);
        } catch (IOException e) {
            log.error("bulk.ingest_failed file={} error={}", file, e.getMessage());
            return new IngestionReport(0, 0, 0, 0, 0,
                    List.of(new IngestionReport.LineError(0, "", "IO error: " + e.getMessage())));
        }
    }

    public IngestionReport ingest(Reader input, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        BufferedReader br = input instanceof BufferedReader b ? b : new BufferedReader(input);
        Counts counts = new Counts();
        List<IngestionReport.LineError> errors = new ArrayList<>();

        List<RecordLine> chunk = new ArrayList<>(chunkSize);
        try {
            Iterator<RecordLine> lines = reader.lines(br);
            while (lines.hasNext()) {
                RecordLine line = lines.next();
                if (!line.isValid()) {
                    counts.invalid++;
                    errors.add(new IngestionReport.LineError(line.lineNumber(), "", line.error()));
                    log.warn("bulk.invalid_line line={} error={}", line.lineNumber(), line.error());
                    continue;
                }
                chunk.add(line);
                if (chunk.size() == chunkSize) {
                    flush(chunk, counts, errors);
                    cb.onProgress(counts.total, -1, "Ingested " + counts.total + " records");
                }
            }
        } catch (UncheckedIOException e) {
            log.error("bulk.read_failed error={}", e.getCause().getMessage());
            errors.add(new IngestionReport.LineError(0, "", "IO error: " + e.getCause().getMessage()));
        }
        flush(chunk, counts, errors);

        IngestionReport report = new IngestionReport(counts.total, counts.indexed, counts.skipped,
                counts.failed, counts.invalid, errors);
        cb.onProgress(counts.total, counts.total, "Ingestion completed");
        log.info("bulk.ingest_completed report={}", report);
        return report;
    }

    private void flush(List<RecordLine> chunk, Counts counts, List<IngestionReport.LineError> errors) {
        if (chunk.isEmpty()) {
            return;
        }
        List<SourceRecord> records = chunk.stream().map(RecordLine::record).toList();
        List<IngestionOutcome> outcomes = pipeline.ingestBatch(records);
        for (int i = 0; i < outcomes.size(); i++) {
            IngestionOutcome outcome = outcomes.get(i);
            counts.total++;
            switch (outcome.status()) {
                case INDEXED -> counts.indexed++;
                case NO_NAME_SKIP -> counts.skipped++;
                default -> {
                    counts.failed++;
                    errors.add(new IngestionReport.LineError(chunk.get(i).lineNumber(), outcome.identifier(),
                            outcome.error() != null ? outcome.error().toString() : outcome.status().name()));
                }
            }
        }
        chunk.clear();
    }

    private static final class Counts {
        long total;
        long indexed;
        long skipped;
        long failed;
        long invalid;
    }
}
