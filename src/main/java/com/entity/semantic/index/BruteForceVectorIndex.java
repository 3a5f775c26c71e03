package com.entity.semantic.index;

import com.entity.semantic.core.model.Embedding;
import com.entity.semantic.core.model.IndexEntry;
import com.entity.semantic.core.model.SemanticHit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exact index: scans every entry. Used as the recall baseline for {@link HnswVectorIndex}
 * and adequate for small collections.
 */
public class BruteForceVectorIndex extends AbstractVectorIndex {

    private static final int DEADLINE_CHECK_INTERVAL = 256;

    private final ConcurrentHashMap<String, IndexEntry> entries = new ConcurrentHashMap<>();

    public BruteForceVectorIndex(int dimension) {
        super(dimension, true);
    }

    @Override
    public void insert(String identifier, String canonicalName, Embedding embedding) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier is required");
        }
        checkVector(embedding);
        entries.put(identifier, new IndexEntry(identifier, canonicalName, embedding));
    }

    @Override
    public QueryResult query(Embedding query, double threshold, int limit, Instant deadline) {
        checkQuery(query, threshold, limit);
        long nanoDeadline = toNanoDeadline(deadline);

        List<SemanticHit> matches = new ArrayList<>();
        boolean truncated = false;
        int visited = 0;
        for (IndexEntry entry : entries.values()) {
            if (visited % DEADLINE_CHECK_INTERVAL == 0 && expired(nanoDeadline)) {
                truncated = true;
                break;
            }
            visited++;
            double similarity = query.cosine(entry.embedding());
            if (similarity >= threshold) {
                matches.add(new SemanticHit(entry.identifier(), entry.canonicalName(), similarity));
            }
        }
        matches.sort(Comparator.comparingDouble(SemanticHit::similarity).reversed()
                .thenComparing(SemanticHit::identifier));
        List<SemanticHit> hits = matches.size() > limit ? matches.subList(0, limit) : matches;
        return new QueryResult(hits, truncated, visited);
    }

    @Override
    public boolean delete(String identifier) {
        return entries.remove(identifier) != null;
    }

    @Override
    public Optional<IndexEntry> get(String identifier) {
        return Optional.ofNullable(entries.get(identifier));
    }

    @Override
    public int size() {
        return entries.size();
    }
}
