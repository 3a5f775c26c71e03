package com.entity.semantic.embedding;

/**
 * Raised by an {@link EmbeddingModel} when it cannot embed its input.
 * {@link #isRetryable()} tells whether the same input may succeed on a later attempt.
 */
public class EmbeddingException extends RuntimeException {

    private final boolean retryable;

    public EmbeddingException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public EmbeddingException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
