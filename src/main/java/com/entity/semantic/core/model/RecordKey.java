package com.entity.semantic.core.model;

import java.util.Objects;

/**
 * Composite key of a source record: the data source code plus the record id.
 * Unique within the system; its {@link #identifier()} is the key used by the vector index.
 *
 * @param dataSource the data source code (for example {@code CUSTOMERS})
 * @param recordId   the record id within that data source
 */
public record RecordKey(String dataSource, String recordId) {

    private static final String SEPARATOR = ":";

    public RecordKey {
        Objects.requireNonNull(dataSource, "dataSource is required");
        Objects.requireNonNull(recordId, "recordId is required");
        if (dataSource.isBlank()) {
            throw new IllegalArgumentException("dataSource must not be blank");
        }
        if (recordId.isBlank()) {
            throw new IllegalArgumentException("recordId must not be blank");
        }
    }

    public static RecordKey of(String dataSource, String recordId) {
        return new RecordKey(dataSource, recordId);
    }

    /**
     * Returns the flat identifier, {@code DATA_SOURCE:RECORD_ID}.
     */
    public String identifier() {
        return dataSource + SEPARATOR + recordId;
    }

    @Override
    public String toString() {
        return identifier();
    }
}
