package com.entity.semantic.health;

/**
 * A check of one component of the candidate-generation stack.
 */
public interface HealthCheck {

    /**
     * Name under which the result is reported.
     */
    String getName();

    HealthStatus check();
}
