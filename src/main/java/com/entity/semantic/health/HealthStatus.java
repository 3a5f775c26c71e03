package com.entity.semantic.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of a component or of the whole service, with a message and free-form details.
 * Statuses are ordered from best to worst.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return up("OK");
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put(key, value);
        return new HealthStatus(status, message, copy);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    /**
     * True when {@code other} is strictly worse than this status.
     */
    boolean isBetterThan(HealthStatus other) {
        return status.ordinal() < other.status.ordinal();
    }
}
