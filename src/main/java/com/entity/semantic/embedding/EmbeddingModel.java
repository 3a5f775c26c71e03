package com.entity.semantic.embedding;

import java.util.List;

/**
 * Black-box text to vector function. Implementations own the loaded model resource for
 * their lifetime and release it in {@link #close()}; they must be safe to call from
 * several threads.
 */
public interface EmbeddingModel extends AutoCloseable {

    /**
     * Embeds a batch of texts.
     *
     * @return one vector per input, in input order
     * @throws EmbeddingException if the batch cannot be embedded
     */
    List<float[]> embedAll(List<String> texts);

    default float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    /**
     * Length of every vector this model produces.
     */
    int dimension();

    String getModelName();

    /**
     * Checks whether the model is loaded or its endpoint reachable.
     */
    boolean isAvailable();

    @Override
    default void close() {
    }
}
