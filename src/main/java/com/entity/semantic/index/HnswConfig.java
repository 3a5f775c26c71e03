package com.entity.semantic.index;

/**
 * Tunables of {@link HnswVectorIndex}.
 *
 * <ul>
 *   <li>{@code dimension}: vector length D shared by every entry</li>
 *   <li>{@code m}: links per node on upper layers; layer 0 allows {@code 2 * m}</li>
 *   <li>{@code efConstruction}: candidate list size while inserting</li>
 *   <li>{@code efSearch}: candidate list size while querying</li>
 *   <li>{@code compactionThreshold}: share of tombstoned nodes that triggers a rebuild of the
 *       graph from the live entries</li>
 *   <li>{@code compactionMinNodes}: graphs smaller than this are never compacted</li>
 * </ul>
 * Larger values raise recall at the cost of latency and memory.
 */
public class HnswConfig {

    public static final int DEFAULT_DIMENSION = 384;
    public static final int DEFAULT_M = 16;
    public static final int DEFAULT_EF_CONSTRUCTION = 200;
    public static final int DEFAULT_EF_SEARCH = 100;
    public static final double DEFAULT_COMPACTION_THRESHOLD = 0.5;
    public static final int DEFAULT_COMPACTION_MIN_NODES = 1000;

    private final int dimension;
    private final int m;
    private final int efConstruction;
    private final int efSearch;
    private final double compactionThreshold;
    private final int compactionMinNodes;

    private HnswConfig(Builder builder) {
        this.dimension = builder.dimension;
        this.m = builder.m;
        this.efConstruction = builder.efConstruction;
        this.efSearch = builder.efSearch;
        this.compactionThreshold = builder.compactionThreshold;
        this.compactionMinNodes = builder.compactionMinNodes;
    }

    public int getDimension() { return dimension; }
    public int getM() { return m; }
    public int getEfConstruction() { return efConstruction; }
    public int getEfSearch() { return efSearch; }
    public double getCompactionThreshold() { return compactionThreshold; }
    public int getCompactionMinNodes() { return compactionMinNodes; }

    /**
     * Maximum links kept per node on the given layer.
     */
    public int maxConnections(int layer) {
        return layer == 0 ? 2 * m : m;
    }

    public static HnswConfig defaults() {
        return builder().build();
    }

    public static HnswConfig withDimension(int dimension) {
        return builder().dimension(dimension).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int dimension = DEFAULT_DIMENSION;
        private int m = DEFAULT_M;
        private int efConstruction = DEFAULT_EF_CONSTRUCTION;
        private int efSearch = DEFAULT_EF_SEARCH;
        private double compactionThreshold = DEFAULT_COMPACTION_THRESHOLD;
        private int compactionMinNodes = DEFAULT_COMPACTION_MIN_NODES;

        public Builder dimension(int dimension) {
            if (dimension <= 0) throw new IllegalArgumentException("dimension must be > 0");
            this.dimension = dimension;
            return this;
        }

        public Builder m(int m) {
            if (m < 2) throw new IllegalArgumentException("m must be >= 2");
            this.m = m;
            return this;
        }

        public Builder efConstruction(int efConstruction) {
            if (efConstruction <= 0) throw new IllegalArgumentException("efConstruction must be > 0");
            this.efConstruction = efConstruction;
            return this;
        }

        public Builder efSearch(int efSearch) {
            if (efSearch <= 0) throw new IllegalArgumentException("efSearch must be > 0");
            this.efSearch = efSearch;
            return this;
        }

        public Builder compactionThreshold(double compactionThreshold) {
            if (!(compactionThreshold > 0.0 && compactionThreshold <= 1.0)) {
                throw new IllegalArgumentException("compactionThreshold must be in (0, 1]");
            }
            this.compactionThreshold = compactionThreshold;
            return this;
        }

        public Builder compactionMinNodes(int compactionMinNodes) {
            if (compactionMinNodes < 0) throw new IllegalArgumentException("compactionMinNodes must be >= 0");
            this.compactionMinNodes = compactionMinNodes;
            return this;
        }

        public HnswConfig build() {
            if (efConstruction < m) {
                throw new IllegalArgumentException("efConstruction must be >= m");
            }
            return new HnswConfig(this);
        }
    }

    @Override
    public String toString() {
        return "HnswConfig{" +
                "dimension=" + dimension +
                ", m=" + m +
                ", efConstruction=" + efConstruction +
                ", efSearch=" + efSearch +
                ", compactionThreshold=" + compactionThreshold +
                '}';
    }
}
