package com.entity.semantic.store;

import java.time.Duration;

/**
 * Outcome of replaying a durable store into a vector index.
 *
 * @param loaded   entries inserted into the index
 * @param rejected entries the index refused (wrong dimension, zero vector)
 * @param duration wall-clock time of the replay
 */
public record RebuildResult(long loaded, long rejected, Duration duration) {

    public boolean isClean() {
        return rejected == 0;
    }
}
