package com.entity.semantic.index;

import com.entity.semantic.core.model.Embedding;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Boundary checks shared by the index implementations: dimension, degenerate vectors,
 * initialization state and query deadlines.
 */
public abstract class AbstractVectorIndex implements VectorIndex {

    private final int dimension;
    private volatile boolean ready;

    protected AbstractVectorIndex(int dimension, boolean ready) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
        this.ready = ready;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public void markReady() {
        ready = true;
    }

    protected void checkVector(Embedding embedding) {
        Objects.requireNonNull(embedding, "embedding is required");
        if (embedding.dimension() != dimension) {
            throw new DimensionMismatchException(dimension, embedding.dimension());
        }
        if (embedding.isZero() || Double.isInfinite(embedding.norm())) {
            throw new DegenerateVectorException("Vector norm is " + embedding.norm()
                    + "; cosine similarity is undefined");
        }
    }

    protected void checkQuery(Embedding query, double threshold, int limit) {
        if (!ready) {
            throw new IndexUnavailableException("Vector index is still initializing");
        }
        checkVector(query);
        if (Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold must be a number");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
    }

    /**
     * Converts a wall-clock deadline into a {@link System#nanoTime()} deadline.
     *
     * @return the nano deadline, or {@link Long#MAX_VALUE} when there is none
     * @throws QueryTimeoutException if the deadline has already passed
     */
    protected static long toNanoDeadline(Instant deadline) {
        if (deadline == null) {
            return Long.MAX_VALUE;
        }
        Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.isZero() || remaining.isNegative()) {
            throw new QueryTimeoutException("Query deadline " + deadline + " passed before traversal started");
        }
        return System.nanoTime() + remaining.toNanos();
    }

    protected static boolean expired(long nanoDeadline) {
        return nanoDeadline != Long.MAX_VALUE && System.nanoTime() - nanoDeadline >= 0;
    }
}
