package com.entity.semantic.core.model;

/**
 * One vector index query result.
 *
 * @param identifier    the matched entry's identifier
 * @param canonicalName the matched entry's name label
 * @param similarity    cosine similarity to the query vector
 */
public record SemanticHit(String identifier, String canonicalName, double similarity) {
}
