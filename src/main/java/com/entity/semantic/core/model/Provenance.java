package com.entity.semantic.core.model;

/**
 * Which candidate-generation source proposed a candidate.
 */
public enum Provenance {
    EXACT,
    SEMANTIC,
    BOTH;

    /**
     * Combines the provenance of the same identifier seen from two sources.
     */
    public Provenance combine(Provenance other) {
        if (this == other) {
            return this;
        }
        return BOTH;
    }
}
