package com.entity.semantic.embedding;

import com.entity.semantic.core.model.Embedding;

/**
 * Outcome for one slot of an embedding batch: a vector, or an error marker.
 *
 * @param text      the input name
 * @param embedding the vector, null on failure
 * @param error     the failure message, null on success
 * @param retryable whether a later attempt may succeed (failures only)
 */
public record EmbeddingResult(String text, Embedding embedding, String error, boolean retryable) {

    public static EmbeddingResult success(String text, Embedding embedding) {
        return new EmbeddingResult(text, embedding, null, false);
    }

    public static EmbeddingResult failure(String text, String error, boolean retryable) {
        return new EmbeddingResult(text, null, error, retryable);
    }

    public boolean isSuccess() {
        return embedding != null;
    }
}
