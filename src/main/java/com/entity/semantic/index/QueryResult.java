package com.entity.semantic.index;

import com.entity.semantic.core.model.SemanticHit;

import java.util.List;

/**
 * Hits of a vector index query, ordered by descending similarity.
 *
 * @param hits      the hits, never more than the requested limit
 * @param truncated true when the query deadline cut the traversal short
 * @param visited   number of graph nodes whose similarity was computed
 */
public record QueryResult(List<SemanticHit> hits, boolean truncated, int visited) {

    public QueryResult {
        hits = hits != null ? List.copyOf(hits) : List.of();
    }

    public static QueryResult empty() {
        return new QueryResult(List.of(), false, 0);
    }

    public int size() {
        return hits.size();
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
