package com.entity.semantic.index;

import com.entity.semantic.core.model.Embedding;
import com.entity.semantic.core.model.IndexEntry;

import java.time.Instant;
import java.util.Optional;

/**
 * Nearest-neighbor index over (identifier, canonical name, embedding) entries,
 * queried by cosine similarity.
 *
 * <p>Implementations must allow concurrent inserts for different identifiers and must be
 * linearizable per identifier: the last completed insert for an identifier wins and no two
 * entries with the same identifier are ever visible.</p>
 */
public interface VectorIndex {

    /**
     * Inserts or replaces the entry for {@code identifier}.
     *
     * @throws DimensionMismatchException if the vector length differs from {@link #dimension()}
     * @throws DegenerateVectorException  if the vector has zero norm
     */
    void insert(String identifier, String canonicalName, Embedding embedding);

    default void insert(IndexEntry entry) {
        insert(entry.identifier(), entry.canonicalName(), entry.embedding());
    }

    /**
     * Returns entries with similarity at or above {@code threshold}, best first,
     * at most {@code limit} of them.
     *
     * @throws IndexUnavailableException if the index has not completed initialization
     */
    default QueryResult query(Embedding query, double threshold, int limit) {
        return query(query, threshold, limit, null);
    }

    /**
     * Same as {@link #query(Embedding, double, int)} with a deadline. A deadline hit during
     * traversal yields the partial result with {@code truncated=true}.
     *
     * @param deadline the deadline, or null for none
     * @throws QueryTimeoutException if the deadline passed before traversal started
     */
    QueryResult query(Embedding query, double threshold, int limit, Instant deadline);

    /**
     * Removes the entry for {@code identifier}.
     *
     * @return true if an entry was removed
     */
    boolean delete(String identifier);

    Optional<IndexEntry> get(String identifier);

    /**
     * Number of live entries, one per identifier.
     */
    int size();

    int dimension();

    /**
     * Whether the index has completed initialization and accepts queries.
     */
    boolean isReady();

    /**
     * Marks initialization as complete.
     */
    void markReady();
}
