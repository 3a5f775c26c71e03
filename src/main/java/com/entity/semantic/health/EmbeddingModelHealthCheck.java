package com.entity.semantic.health;

import com.entity.semantic.embedding.EmbeddingModel;

/**
 * Reports whether the embedding model is loaded or its endpoint reachable.
 */
public class EmbeddingModelHealthCheck implements HealthCheck {

    private final EmbeddingModel model;

    public EmbeddingModelHealthCheck(EmbeddingModel model) {
        this.model = model;
    }

    @Override
    public String getName() {
        return "embeddingModel";
    }

    @Override
    public HealthStatus check() {
        HealthStatus status = model.isAvailable()
                ? HealthStatus.up()
                : HealthStatus.down("Embedding model unavailable");
        return status
                .withDetail("model", model.getModelName())
                .withDetail("dimension", model.dimension());
    }
}
