package com.entity.semantic.index;

import com.entity.semantic.core.model.Embedding;
import com.entity.semantic.core.model.IndexEntry;
import com.entity.semantic.core.model.SemanticHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Hierarchical navigable small world graph over cosine similarity.
 *
 * <h2>Structure</h2>
 * <p>Every entry is a node with a random top layer drawn from an exponential distribution
 * ({@code floor(-ln(U) / ln(M))}). On each layer a node links to at most {@code M} neighbors
 * ({@code 2M} on layer 0), chosen with the diversity heuristic from the HNSW paper.
 * Inserts and queries descend greedily from the entry point through the upper layers and
 * run a beam search of width {@code ef} on the lower ones.</p>
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>Reads take no lock. Neighbor lists are immutable arrays published through an
 *       {@link AtomicReferenceArray}; a writer replaces the array under the owning node's monitor.</li>
 *   <li>Inserts for the same identifier are serialized by a striped lock, so the last
 *       completed insert wins.</li>
 *   <li>A node is linked into the graph before it becomes the live entry of its identifier,
 *       so queries never see a half-built entry.</li>
 * </ul>
 *
 * <h2>Replacement and deletion</h2>
 * <p>A replaced or deleted node stays in the graph as a routing tombstone. Queries traverse
 * tombstones but never keep them in the result beam. Once tombstones reach
 * {@link HnswConfig#getCompactionThreshold()} of the nodes (and the graph holds at least
 * {@link HnswConfig#getCompactionMinNodes()} nodes), the graph is rebuilt from the live
 * entries. Writers wait for the rebuild; queries keep reading the previous graph until the
 * rebuilt one is swapped in.</p>
 */
public class HnswVectorIndex extends AbstractVectorIndex {
    private static final Logger log = LoggerFactory.getLogger(HnswVectorIndex.class);

    private static final int LOCK_STRIPES = 64;
    private static final int MAX_LEVEL = 32;
    private static final Node[] NO_NEIGHBORS = new Node[0];

    private static final Comparator<Scored> BY_SIMILARITY = Comparator.comparingDouble(Scored::similarity);

    private final HnswConfig config;
    private final double levelMultiplier;
    private final ReentrantLock[] identifierLocks = new ReentrantLock[LOCK_STRIPES];
    private final ReentrantReadWriteLock compactionLock = new ReentrantReadWriteLock();
    private final AtomicInteger compactions = new AtomicInteger();
    private volatile Graph graph = new Graph();

    public HnswVectorIndex(HnswConfig config) {
        this(config, true);
    }

    private HnswVectorIndex(HnswConfig config, boolean ready) {
        super(config.getDimension(), ready);
        this.config = config;
        this.levelMultiplier = 1.0 / Math.log(config.getM());
        for (int i = 0; i < LOCK_STRIPES; i++) {
            identifierLocks[i] = new ReentrantLock();
        }
        log.info("HnswVectorIndex initialized: {} ready={}", config, ready);
    }

    /**
     * Creates an index that accepts inserts but rejects queries with
     * {@link IndexUnavailableException} until {@link #markReady()} is called.
     */
    public static HnswVectorIndex initializing(HnswConfig config) {
        return new HnswVectorIndex(config, false);
    }

    @Override
    public void insert(String identifier, String canonicalName, Embedding embedding) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier is required");
        }
        if (canonicalName == null) {
            throw new IllegalArgumentException("canonicalName is required");
        }
        checkVector(embedding);

        ReentrantLock lock = lockFor(identifier);
        compactionLock.readLock().lock();
        lock.lock();
        try {
            Graph g = graph;
            Node existing = g.live.get(identifier);
            if (existing != null && existing.label.equals(canonicalName) && existing.embedding.equals(embedding)) {
                log.trace("index.insert.unchanged identifier={}", identifier);
                return;
            }
            Node node = new Node(identifier, canonicalName, embedding, randomLevel());
            link(g, node);
            g.live.put(identifier, node);
            if (existing != null) {
                existing.removed = true;
                g.tombstones.incrementAndGet();
                log.debug("index.insert.replaced identifier={}", identifier);
            }
        } finally {
            lock.unlock();
            compactionLock.readLock().unlock();
        }
        compactIfNeeded();
    }

    @Override
    public QueryResult query(Embedding query, double threshold, int limit, Instant deadline) {
        checkQuery(query, threshold, limit);
        long nanoDeadline = toNanoDeadline(deadline);

        Graph g = graph;
        Node ep = g.entryPoint;
        if (ep == null) {
            return QueryResult.empty();
        }

        int visited = 0;
        Node current = ep;
        for (int layer = ep.level; layer > 0; layer--) {
            LayerSearch step = searchLayer(query, List.of(current), 1, layer, nanoDeadline, false);
            visited += step.visited();
            if (step.truncated()) {
                return collect(g, step.results(), threshold, limit, true, visited);
            }
            current = step.results().get(0).node();
        }

        LayerSearch base = searchLayer(query, List.of(current), Math.max(config.getEfSearch(), limit), 0,
                nanoDeadline, true);
        visited += base.visited();
        if (base.truncated()) {
            log.debug("index.query.truncated visited={}", visited);
        }
        return collect(g, base.results(), threshold, limit, base.truncated(), visited);
    }

    @Override
    public boolean delete(String identifier) {
        ReentrantLock lock = lockFor(identifier);
        compactionLock.readLock().lock();
        lock.lock();
        try {
            Graph g = graph;
            Node removed = g.live.remove(identifier);
            if (removed == null) {
                return false;
            }
            removed.removed = true;
            g.tombstones.incrementAndGet();
            log.debug("index.delete identifier={}", identifier);
        } finally {
            lock.unlock();
            compactionLock.readLock().unlock();
        }
        compactIfNeeded();
        return true;
    }

    @Override
    public Optional<IndexEntry> get(String identifier) {
        Node node = graph.live.get(identifier);
        return node == null ? Optional.empty()
                : Optional.of(new IndexEntry(node.identifier, node.label, node.embedding));
    }

    @Override
    public int size() {
        return graph.live.size();
    }

    /**
     * Number of graph nodes, including tombstones.
     */
    public int nodeCount() {
        return graph.nodeCount.get();
    }

    /**
     * Replaced or deleted nodes still used for routing.
     */
    public int tombstoneCount() {
        return graph.tombstones.get();
    }

    /**
     * Number of times the graph has been rebuilt from its live entries.
     */
    public int compactionCount() {
        return compactions.get();
    }

    /**
     * Highest layer currently in the graph, or -1 when empty.
     */
    public int topLayer() {
        Node ep = graph.entryPoint;
        return ep == null ? -1 : ep.level;
    }

    public HnswConfig getConfig() {
        return config;
    }

    /**
     * Rebuilds the graph from the live entries, dropping every tombstone. Blocks writers
     * for the duration; queries continue against the previous graph.
     */
    public void compact() {
        compactionLock.writeLock().lock();
        try {
            rebuild();
        } finally {
            compactionLock.writeLock().unlock();
        }
    }

    private void compactIfNeeded() {
        if (!needsCompaction(graph)) {
            return;
        }
        compactionLock.writeLock().lock();
        try {
            if (needsCompaction(graph)) {
                rebuild();
            }
        } finally {
            compactionLock.writeLock().unlock();
        }
    }

    private boolean needsCompaction(Graph g) {
        int nodes = g.nodeCount.get();
        return nodes > 0 && nodes >= config.getCompactionMinNodes()
                && g.tombstones.get() >= config.getCompactionThreshold() * nodes;
    }

    // Caller holds the compaction write lock, so no writer touches the old graph.
    private void rebuild() {
        long start = System.nanoTime();
        Graph old = graph;
        Graph rebuilt = new Graph();
        for (Node node : old.live.values()) {
            Node copy = new Node(node.identifier, node.label, node.embedding, node.level);
            link(rebuilt, copy);
            rebuilt.live.put(copy.identifier, copy);
        }
        graph = rebuilt;
        compactions.incrementAndGet();
        log.info("index.compacted nodes={} -> {} tombstonesDropped={} durationMs={}",
                old.nodeCount.get(), rebuilt.nodeCount.get(), old.tombstones.get(),
                (System.nanoTime() - start) / 1_000_000);
    }

    // ── Graph construction ───────────────────────────────────

    private void link(Graph g, Node node) {
        g.nodeCount.incrementAndGet();
        Node ep = g.entryPoint;
        if (ep == null) {
            synchronized (g.entryPointLock) {
                if (g.entryPoint == null) {
                    g.entryPoint = node;
                    return;
                }
                ep = g.entryPoint;
            }
        }

        Embedding vector = node.embedding;
        Node current = ep;
        for (int layer = ep.level; layer > node.level; layer--) {
            current = searchLayer(vector, List.of(current), 1, layer, Long.MAX_VALUE, false).results().get(0).node();
        }

        // Fill the new node's own lists top-down before any other node points at it.
        int top = Math.min(node.level, ep.level);
        Node[][] selectedPerLayer = new Node[top + 1][];
        List<Node> entryPoints = List.of(current);
        for (int layer = top; layer >= 0; layer--) {
            List<Scored> found = searchLayer(vector, entryPoints, config.getEfConstruction(), layer,
                    Long.MAX_VALUE, false).results();
            Node[] selected = selectNeighbors(found, config.getM());
            node.neighbors.set(layer, selected);
            selectedPerLayer[layer] = selected;
            entryPoints = found.stream().map(Scored::node).toList();
        }

        for (int layer = top; layer >= 0; layer--) {
            for (Node neighbor : selectedPerLayer[layer]) {
                addBackLink(neighbor, node, layer);
            }
        }

        if (node.level > ep.level) {
            synchronized (g.entryPointLock) {
                if (node.level > g.entryPoint.level) {
                    g.entryPoint = node;
                    log.debug("index.entrypoint.raised level={} identifier={}", node.level, node.identifier);
                }
            }
        }
    }

    private void addBackLink(Node target, Node source, int layer) {
        int max = config.maxConnections(layer);
        synchronized (target) {
            Node[] current = target.neighbors.get(layer);
            for (Node n : current) {
                if (n == source) {
                    return;
                }
            }
            Node[] grown = Arrays.copyOf(current, current.length + 1);
            grown[current.length] = source;
            if (grown.length > max) {
                List<Scored> scored = new ArrayList<>(grown.length);
                for (Node n : grown) {
                    scored.add(new Scored(n, target.embedding.cosine(n.embedding)));
                }
                scored.sort(BY_SIMILARITY.reversed());
                grown = selectNeighbors(scored, max);
            }
            target.neighbors.set(layer, grown);
        }
    }

    /**
     * Diversity heuristic: keep a candidate only if it is closer to the base than to every
     * neighbor already kept, then top up with the best pruned candidates. Live nodes are
     * preferred over tombstones.
     *
     * @param candidates scored against the base vector, best first
     */
    private Node[] selectNeighbors(List<Scored> candidates, int m) {
        List<Scored> ordered = new ArrayList<>(candidates.size());
        for (Scored c : candidates) {
            if (!c.node().removed) {
                ordered.add(c);
            }
        }
        for (Scored c : candidates) {
            if (c.node().removed) {
                ordered.add(c);
            }
        }

        List<Node> selected = new ArrayList<>(m);
        List<Node> pruned = new ArrayList<>();
        for (Scored candidate : ordered) {
            if (selected.size() >= m) {
                break;
            }
            boolean diverse = true;
            for (Node kept : selected) {
                if (candidate.node().embedding.cosine(kept.embedding) > candidate.similarity()) {
                    diverse = false;
                    break;
                }
            }
            if (diverse) {
                selected.add(candidate.node());
            } else {
                pruned.add(candidate.node());
            }
        }
        for (int i = 0; i < pruned.size() && selected.size() < m; i++) {
            selected.add(pruned.get(i));
        }
        return selected.toArray(NO_NEIGHBORS);
    }

    // ── Search ───────────────────────────────────────────────

    /**
     * Beam search on one layer. With {@code liveOnly}, tombstones are expanded for routing but
     * kept out of the result beam, so they never take one of the {@code ef} slots.
     *
     * @return up to {@code ef} nodes, best first
     */
    private LayerSearch searchLayer(Embedding query, List<Node> entryPoints, int ef, int layer, long nanoDeadline,
                                    boolean liveOnly) {
        Set<Node> visited = new HashSet<>();
        PriorityQueue<Scored> candidates = new PriorityQueue<>(BY_SIMILARITY.reversed());
        PriorityQueue<Scored> results = new PriorityQueue<>(BY_SIMILARITY);

        for (Node ep : entryPoints) {
            if (visited.add(ep)) {
                Scored scored = new Scored(ep, query.cosine(ep.embedding));
                candidates.add(scored);
                if (!liveOnly || !ep.removed) {
                    results.add(scored);
                    if (results.size() > ef) {
                        results.poll();
                    }
                }
            }
        }

        boolean truncated = false;
        while (!candidates.isEmpty()) {
            if (expired(nanoDeadline)) {
                truncated = true;
                break;
            }
            Scored closest = candidates.poll();
            if (results.size() >= ef && closest.similarity() < results.peek().similarity()) {
                break;
            }
            for (Node neighbor : closest.node().neighbors.get(layer)) {
                if (!visited.add(neighbor)) {
                    continue;
                }
                double similarity = query.cosine(neighbor.embedding);
                if (results.size() < ef || similarity > results.peek().similarity()) {
                    Scored scored = new Scored(neighbor, similarity);
                    candidates.add(scored);
                    if (!liveOnly || !neighbor.removed) {
                        results.add(scored);
                        if (results.size() > ef) {
                            results.poll();
                        }
                    }
                }
            }
        }

        List<Scored> ordered = new ArrayList<>(results);
        ordered.sort(BY_SIMILARITY.reversed());
        return new LayerSearch(ordered, truncated, visited.size());
    }

    private QueryResult collect(Graph g, List<Scored> found, double threshold, int limit, boolean truncated,
                                int visited) {
        List<SemanticHit> hits = new ArrayList<>(Math.min(limit, found.size()));
        Set<String> seen = new HashSet<>();
        List<Scored> ordered = new ArrayList<>(found);
        ordered.sort(BY_SIMILARITY.reversed().thenComparing(s -> s.node().identifier));
        for (Scored scored : ordered) {
            if (hits.size() >= limit) {
                break;
            }
            Node node = scored.node();
            if (scored.similarity() < threshold || g.live.get(node.identifier) != node) {
                continue;
            }
            if (seen.add(node.identifier)) {
                hits.add(new SemanticHit(node.identifier, node.label, scored.similarity()));
            }
        }
        return new QueryResult(hits, truncated, visited);
    }

    private int randomLevel() {
        double uniform = 1.0 - ThreadLocalRandom.current().nextDouble();
        int level = (int) Math.floor(-Math.log(uniform) * levelMultiplier);
        return Math.min(level, MAX_LEVEL);
    }

    private ReentrantLock lockFor(String identifier) {
        return identifierLocks[Math.floorMod(identifier.hashCode(), LOCK_STRIPES)];
    }

    private static final class Node {
        final String identifier;
        final String label;
        final Embedding embedding;
        final int level;
        final AtomicReferenceArray<Node[]> neighbors;
        volatile boolean removed;

        Node(String identifier, String label, Embedding embedding, int level) {
            this.identifier = identifier;
            this.label = label;
            this.embedding = embedding;
            this.level = level;
            this.neighbors = new AtomicReferenceArray<>(level + 1);
            for (int i = 0; i <= level; i++) {
                neighbors.set(i, NO_NEIGHBORS);
            }
        }
    }

    private static final class Graph {
        final ConcurrentHashMap<String, Node> live = new ConcurrentHashMap<>();
        final Object entryPointLock = new Object();
        final AtomicInteger nodeCount = new AtomicInteger();
        final AtomicInteger tombstones = new AtomicInteger();
        volatile Node entryPoint;
    }

    private record Scored(Node node, double similarity) {}

    private record LayerSearch(List<Scored> results, boolean truncated, int visited) {}
}
