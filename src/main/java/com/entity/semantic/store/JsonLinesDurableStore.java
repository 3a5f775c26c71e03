package com.entity.semantic.store;

import com.entity.semantic.core.model.Embedding;
import com.entity.semantic.core.model.IndexEntry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only JSON Lines log of index entries.
 *
 * <pre>
 * {"op":"PUT","identifier":"CUSTOMERS:1001","name":"Robert Johnson","embedding":[0.1, ...]}
 * {"op":"DELETE","identifier":"CUSTOMERS:1001"}
 * </pre>
 *
 * <p>The log is replayed into memory on open; later lines win. {@link #compact()} rewrites
 * the file with one PUT per live entry. A truncated trailing line left by a crash is
 * skipped with a warning.</p>
 */
public class JsonLinesDurableStore implements DurableStore {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesDurableStore.class);

    private static final String PUT = "PUT";
    private static final String DELETE = "DELETE";

    private final Path path;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, IndexEntry> entries = new LinkedHashMap<>();
    private BufferedWriter writer;
    private long appendedLines;

    public JsonLinesDurableStore(Path path) {
        this.path = path;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(path)) {
                replay();
                terminateLastLine();
            }
            this.writer = openWriter();
        } catch (IOException e) {
            throw new StoreException("Cannot open store " + path + ": " + e.getMessage(), e);
        }
        log.info("store.opened path={} entries={}", path, entries.size());
    }

    private void replay() throws IOException {
        long lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                StoredLine stored;
                try {
                    stored = objectMapper.readValue(line, StoredLine.class);
                } catch (JsonProcessingException e) {
                    log.warn("store.unreadable_line path={} line={} error={}", path, lineNumber, e.getOriginalMessage());
                    continue;
                }
                appendedLines++;
                if (DELETE.equals(stored.op())) {
                    entries.remove(stored.identifier());
                } else if (PUT.equals(stored.op()) && stored.identifier() != null && stored.name() != null
                        && stored.embedding() != null) {
                    entries.put(stored.identifier(),
                            new IndexEntry(stored.identifier(), stored.name(), Embedding.of(stored.embedding())));
                } else {
                    log.warn("store.invalid_line path={} line={} op={}", path, lineNumber, stored.op());
                }
            }
        }
    }

    /**
     * Ends a truncated trailing line so the next append starts on a line of its own.
     */
    private void terminateLastLine() throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(path, StandardOpenOption.READ,
                StandardOpenOption.WRITE)) {
            long size = channel.size();
            if (size == 0) {
                return;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1).read(last);
            if (last.get(0) != '\n') {
                log.warn("store.truncated_tail path={} terminating partial line", path);
                channel.position(size).write(ByteBuffer.wrap(new byte[]{'\n'}));
            }
        }
    }

    private BufferedWriter openWriter() throws IOException {
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Override
    public synchronized void save(IndexEntry entry) {
        append(new StoredLine(PUT, entry.identifier(), entry.canonicalName(), entry.embedding().toArray()));
        entries.remove(entry.identifier());
        entries.put(entry.identifier(), entry);
    }

    @Override
    public synchronized boolean delete(String identifier) {
        if (!entries.containsKey(identifier)) {
            return false;
        }
        append(new StoredLine(DELETE, identifier, null, null));
        entries.remove(identifier);
        return true;
    }

    private void append(StoredLine line) {
        if (writer == null) {
            throw new StoreException("Store " + path + " is closed");
        }
        try {
            writer.write(objectMapper.writeValueAsString(line));
            writer.newLine();
            writer.flush();
            appendedLines++;
        } catch (IOException e) {
            throw new StoreException("Write to " + path + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized Iterator<IndexEntry> scan() {
        return new ArrayList<>(entries.values()).iterator();
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    /**
     * Number of lines in the log, including superseded PUTs and DELETEs.
     */
    public synchronized long logLength() {
        return appendedLines;
    }

    /**
     * Rewrites the log with one PUT line per live entry and swaps it in atomically.
     */
    public synchronized void compact() {
        Path tmp = path.resolveSibling(path.getFileName() + ".compact");
        try {
            try (BufferedWriter out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                for (IndexEntry entry : entries.values()) {
                    out.write(objectMapper.writeValueAsString(new StoredLine(PUT, entry.identifier(),
                            entry.canonicalName(), entry.embedding().toArray())));
                    out.newLine();
                }
            }
            if (writer != null) {
                writer.close();
            }
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            long before = appendedLines;
            appendedLines = entries.size();
            writer = openWriter();
            log.info("store.compacted path={} lines={} -> {}", path, before, appendedLines);
        } catch (IOException e) {
            throw new StoreException("Compaction of " + path + " failed: " + e.getMessage(), e);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getName() {
        return "jsonl:" + path.getFileName();
    }

    @Override
    public synchronized void close() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            throw new StoreException("Close of " + path + " failed: " + e.getMessage(), e);
        } finally {
            writer = null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record StoredLine(String op, String identifier, String name, float[] embedding) {}
}
