package com.entity.semantic.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A record submitted for ingestion or search: its composite key and its field tree.
 * Re-submitting a record with the same key replaces the earlier state.
 */
public record SourceRecord(RecordKey key, RecordNode.MapNode body) {

    public static final String DATA_SOURCE_FIELD = "DATA_SOURCE";
    public static final String RECORD_ID_FIELD = "RECORD_ID";

    public SourceRecord {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(body, "body is required");
    }

    public static SourceRecord of(RecordKey key, Map<String, ?> fields) {
        return new SourceRecord(key, RecordNode.fromMap(fields));
    }

    /**
     * Builds a record from a parsed map that carries {@code DATA_SOURCE} and {@code RECORD_ID}
     * at the top level.
     *
     * @throws IllegalArgumentException if either key field is missing or blank
     */
    public static SourceRecord fromMap(Map<String, ?> fields) {
        Object dataSource = fields.get(DATA_SOURCE_FIELD);
        Object recordId = fields.get(RECORD_ID_FIELD);
        if (dataSource == null || recordId == null) {
            throw new IllegalArgumentException("Record must carry " + DATA_SOURCE_FIELD
                    + " and " + RECORD_ID_FIELD);
        }
        return of(RecordKey.of(dataSource.toString(), recordId.toString()), fields);
    }

    public String identifier() {
        return key.identifier();
    }
}
