package com.entity.semantic.core.model;

import java.util.Objects;

/**
 * An (identifier, canonical name, embedding) triple as stored in the vector index
 * and in the durable store.
 */
public record IndexEntry(String identifier, String canonicalName, Embedding embedding) {

    public IndexEntry {
        Objects.requireNonNull(identifier, "identifier is required");
        Objects.requireNonNull(canonicalName, "canonicalName is required");
        Objects.requireNonNull(embedding, "embedding is required");
    }
}
