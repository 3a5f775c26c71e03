package com.entity.semantic.tracing;

/**
 * The traced units of work. Each operation owns its span name, the attribute that
 * identifies what it works on, and the prefix of its measurement attributes.
 */
public enum TracedOperation {
    INGEST("semantic.ingest", "semantic.batch.id"),
    QUERY("semantic.query", "semantic.request.id"),
    EMBED_BATCH("semantic.embed.batch", "semantic.model"),
    REBUILD("semantic.rebuild", "semantic.store");

    private final String spanName;
    private final String subjectKey;

    TracedOperation(String spanName, String subjectKey) {
        this.spanName = spanName;
        this.subjectKey = subjectKey;
    }

    public String spanName() {
        return spanName;
    }

    public String subjectKey() {
        return subjectKey;
    }

    /**
     * Attribute key of a measurement, e.g. {@code semantic.rebuild.loaded}.
     */
    public String measureKey(String measure) {
        return spanName + "." + measure;
    }
}
