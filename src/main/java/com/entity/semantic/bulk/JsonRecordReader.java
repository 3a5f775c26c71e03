package com.entity.semantic.bulk;

import com.entity.semantic.core.model.SourceRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.NoSuchElementException;

/**
 * Reads JSON Lines records. Each line is a JSON object carrying {@code DATA_SOURCE} and
 * {@code RECORD_ID}; field order is preserved.
 *
 * <pre>
 * {"DATA_SOURCE": "CUSTOMERS", "RECORD_ID": "1001", "NAME_FULL": "Robert Johnson"}
 * {"DATA_SOURCE": "CUSTOMERS", "RECORD_ID": "1002", "NAME_FIRST": "Bob", "NAME_LAST": "Johnson"}
 * </pre>
 *
 * Blank lines are skipped. Unreadable lines are returned with an error instead of a record.
 */
public class JsonRecordReader {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonRecordReader() {
        this(new ObjectMapper());
    }

    public JsonRecordReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses one line.
     */
    public RecordLine parse(long lineNumber, String line) {
        try {
            LinkedHashMap<String, Object> fields = objectMapper.readValue(line, FIELDS);
            return new RecordLine(lineNumber, SourceRecord.fromMap(fields), null);
        } catch (JsonProcessingException e) {
            return new RecordLine(lineNumber, null, "invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return new RecordLine(lineNumber, null, e.getMessage());
        }
    }

    /**
     * Lazily iterates over the non-blank lines of {@code reader}.
     *
     * @throws UncheckedIOException from the iterator if reading fails
     */
    public Iterator<RecordLine> lines(BufferedReader reader) {
        return new Iterator<>() {
            private long lineNumber;
            private RecordLine next;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                try {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        lineNumber++;
                        if (!line.isBlank()) {
                            next = parse(lineNumber, line.trim());
                            return true;
                        }
                    }
                    return false;
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }

            @Override
            public RecordLine next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                RecordLine line = next;
                next = null;
                return line;
            }
        };
    }
}
