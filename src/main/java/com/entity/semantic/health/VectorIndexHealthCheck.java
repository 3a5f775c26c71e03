package com.entity.semantic.health;

import com.entity.semantic.index.HnswVectorIndex;
import com.entity.semantic.index.VectorIndex;

/**
 * DOWN while the index is initializing. For an HNSW index, DEGRADED once routing
 * tombstones make up at least half of the graph.
 */
public class VectorIndexHealthCheck implements HealthCheck {

    private static final double TOMBSTONE_DEGRADED_RATIO = 0.5;

    private final VectorIndex index;

    public VectorIndexHealthCheck(VectorIndex index) {
        this.index = index;
    }

    @Override
    public String getName() {
        return "vectorIndex";
    }

    @Override
    public HealthStatus check() {
        if (!index.isReady()) {
            return HealthStatus.down("Index is initializing")
                    .withDetail("entries", index.size());
        }

        HealthStatus status = HealthStatus.up();
        if (index instanceof HnswVectorIndex hnsw) {
            int nodes = hnsw.nodeCount();
            int tombstones = hnsw.tombstoneCount();
            double ratio = nodes > 0 ? (double) tombstones / nodes : 0.0;
            if (ratio >= TOMBSTONE_DEGRADED_RATIO) {
                status = HealthStatus.degraded(String.format("Tombstones at %.1f%% of graph, rebuild advised",
                        ratio * 100));
            }
            status = status
                    .withDetail("nodes", nodes)
                    .withDetail("tombstones", tombstones)
                    .withDetail("topLayer", hnsw.topLayer());
        }
        return status
                .withDetail("entries", index.size())
                .withDetail("dimension", index.dimension());
    }
}
